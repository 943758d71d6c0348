// file: server/src/main/java/io/opledger/server/RequestLogger.java
package io.opledger.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One access-log line per HTTP request.
 *
 * Levels:
 *  - 5xx: WARNING, with the exception when there is one.
 *  - 4xx: FINE; client mistakes are not operator news.
 *  - everything else: INFO.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * @param totalMillis    wall-clock latency for the whole request
     * @param registryMillis time spent inside RegistryService, or -1 if not called
     * @param error          exception that produced the status, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long registryMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                registryMillis >= 0 ? ", registry=" + registryMillis + "ms" : ""
        );

        if (status >= 500) {
            if (error != null) {
                log.log(Level.WARNING, msg, error);
            } else {
                log.warning(msg);
            }
        } else if (status >= 400) {
            log.log(Level.FINE, error != null ? msg + ": " + error.getMessage() : msg);
        } else {
            log.info(msg);
        }
    }
}
