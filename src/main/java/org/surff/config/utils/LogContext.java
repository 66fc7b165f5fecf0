package org.surff.config.utils;

import org.slf4j.MDC;

import java.net.SocketAddress;
import java.util.UUID;

/**
 * MDC context for log correlation.
 * Adds "component" and "trace.id" to every log entry of the current thread,
 * plus "remote" while a connection is being served.
 * Jobs run on pool threads, so each job starts and clears its own context.
 */
public class LogContext {
    private LogContext() {}

    public static void start(String component) {
        MDC.put("component", component);
        MDC.put("trace.id", UUID.randomUUID().toString());
    }

    public static void startConnection(String component, SocketAddress remote) {
        start(component);
        MDC.put("remote", String.valueOf(remote));
    }

    public static void clear() {
        MDC.clear();
    }
}
