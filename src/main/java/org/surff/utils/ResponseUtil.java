package org.surff.utils;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Serializes a {@link Response} as raw HTTP/1.1 bytes.
 * The connection is not kept alive, so every response announces {@code Connection: close}.
 */
public class ResponseUtil {

    private static final String CRLF = "\r\n";

    private ResponseUtil() {}

    public static byte[] toBytes(Response response) {
        String head = response.statusLine() + CRLF
                + "Content-Type: " + response.contentType() + CRLF
                + "Content-Length: " + response.body().length + CRLF
                + "Connection: close" + CRLF
                + CRLF;
        byte[] headBytes = head.getBytes(StandardCharsets.US_ASCII);
        byte[] out = new byte[headBytes.length + response.body().length];
        System.arraycopy(headBytes, 0, out, 0, headBytes.length);
        System.arraycopy(response.body(), 0, out, headBytes.length, response.body().length);
        return out;
    }

    public static void send(OutputStream out, Response response) throws IOException {
        out.write(toBytes(response));
        out.flush();
    }
}
