// file: server/src/main/java/io/mural/server/RequestLogger.java
package io.mural.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the board HTTP API.
 *
 * Responsibilities:
 *  - Central place to log node/method/path/status and latency.
 *  - 5xx responses at WARNING (with the cause when known), everything else at INFO.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param nodeId      node that served the request
     * @param method      HTTP method
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param storeMillis time spent in the board engine, or -1 if not measured
     * @param error       exception behind an error status, null if none
     */
    public static void logRequest(
            String nodeId,
            String method,
            String path,
            int status,
            long totalMillis,
            long storeMillis,
            Throwable error
    ) {
        String msg = String.format(
                "[%s] HTTP %s %s -> %d (total=%dms%s)",
                nodeId,
                method,
                path,
                status,
                totalMillis,
                storeMillis >= 0 ? ", board=" + storeMillis + "ms" : ""
        );

        if (status >= 500) {
            if (error != null) {
                log.log(Level.WARNING, msg, error);
            } else {
                log.log(Level.WARNING, msg);
            }
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
