package org.surff.handlers;

import org.surff.utils.HttpRequestUtil;

/**
 * Request lines the server recognizes. Matching is a byte prefix test on the
 * start of the request, nothing more.
 */
public enum Route {
    ROOT("GET / HTTP/1.1\r\n"),
    SLEEP("GET /sleep HTTP/1.1\r\n"),
    HEALTH("GET /health HTTP/1.1\r\n"),
    NOT_FOUND(null);

    private final String requestLine;

    Route(String requestLine) {
        this.requestLine = requestLine;
    }

    public static Route match(byte[] request, int length) {
        for (Route route : values()) {
            if (route.requestLine != null && HttpRequestUtil.startsWith(request, length, route.requestLine)) {
                return route;
            }
        }
        return NOT_FOUND;
    }
}
