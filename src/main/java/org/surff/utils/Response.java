package org.surff.utils;

import java.nio.charset.StandardCharsets;

/**
 * A complete response ready to be written to a connection.
 *
 * @param statusLine e.g. {@code HTTP/1.1 200 OK}, without the line terminator
 */
public record Response(String statusLine, String contentType, byte[] body) {

    public static final String OK = "HTTP/1.1 200 OK";
    public static final String NOT_FOUND = "HTTP/1.1 404 NOT FOUND";

    public static final String HTML = "text/html; charset=utf-8";
    public static final String JSON = "application/json";

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
