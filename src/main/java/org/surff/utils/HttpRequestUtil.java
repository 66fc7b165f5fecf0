package org.surff.utils;

import java.nio.charset.StandardCharsets;

/**
 * Helpers over the raw bytes of a request read from a socket.
 */
public class HttpRequestUtil {

    private HttpRequestUtil() {}

    /**
     * True when the first {@code length} bytes of {@code buffer} start with {@code prefix} (ASCII).
     */
    public static boolean startsWith(byte[] buffer, int length, String prefix) {
        byte[] p = prefix.getBytes(StandardCharsets.US_ASCII);
        if (length < p.length || buffer.length < p.length) return false;
        for (int i = 0; i < p.length; i++) {
            if (buffer[i] != p[i]) return false;
        }
        return true;
    }

    /**
     * The request line without its terminator, for logging. Empty if nothing was read.
     */
    public static String requestLine(byte[] buffer, int length) {
        String text = new String(buffer, 0, Math.max(length, 0), StandardCharsets.UTF_8);
        int end = text.indexOf("\r\n");
        return end >= 0 ? text.substring(0, end) : text;
    }
}
