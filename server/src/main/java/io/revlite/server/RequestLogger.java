// file: server/src/main/java/io/revlite/server/RequestLogger.java
package io.revlite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place for per-invocation logging on the provider endpoint.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a handled invocation.
     *
     * @param peer        remote address of the connection
     * @param command     invocation command (get, tx, subscribe, ...)
     * @param subject     memory space the command applied to
     * @param outcome     "ok" or the returned error's name
     * @param totalMillis wall-clock time spent handling the invocation
     * @param error       unexpected exception, null if none
     */
    public static void logInvocation(
            String peer,
            String command,
            String subject,
            String outcome,
            long totalMillis,
            Throwable error
    ) {
        String msg = String.format(
                "WS %s %s %s -> %s (total=%dms)",
                peer,
                command,
                subject,
                outcome,
                totalMillis
        );

        if (error != null) {
            log.log(Level.WARNING, msg, error);
        } else if (!"ok".equals(outcome)) {
            log.log(Level.INFO, msg);
        } else {
            log.log(Level.FINE, msg);
        }
    }

    /** Log a connection lifecycle event. */
    public static void logConnection(String peer, String event) {
        log.log(Level.INFO, "WS " + peer + " " + event);
    }
}
