// file: server/src/main/java/io/dripline/server/RequestLogger.java
package io.dripline.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the HTTP API.
 *
 * Responsibilities:
 *  - One line per request with method, path, status and latency.
 *  - 5xx at WARNING (with the cause if any), refused calls (4xx) at FINE detail.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method        HTTP method
     * @param path          request path
     * @param status        HTTP status code
     * @param totalMillis   wall-clock latency for the whole request
     * @param serviceMillis time spent inside the distributor, or -1 if it was not reached
     * @param error         exception behind a non-2xx reply, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long serviceMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                serviceMillis >= 0 ? ", service=" + serviceMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else {
            log.log(Level.INFO, msg);
            if (error != null && log.isLoggable(Level.FINE)) {
                log.fine(msg + ": " + error.getMessage());
            }
        }
    }
}
