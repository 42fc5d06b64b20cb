// file: server/src/main/java/io/leafsync/server/ConnectionLogger.java
package io.leafsync.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place for request and connection logging of the hub server.
 */
public final class ConnectionLogger {
    private static final Logger log = Logger.getLogger(ConnectionLogger.class.getName());

    private ConnectionLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     */
    public static void logRequest(String method, String path, int status, long totalMillis) {
        String msg = String.format("HTTP %s %s -> %d (total=%dms)", method, path, status, totalMillis);
        log.log(status >= 500 ? Level.WARNING : Level.INFO, msg);
    }

    public static void logOpened(String peer) {
        log.info(() -> "sync connection opened from " + peer);
    }

    /**
     * @param frames client frames received over the connection's lifetime
     */
    public static void logClosed(String peer, long openMillis, long frames) {
        log.info(() -> String.format("sync connection from %s closed (open=%dms, frames=%d)", peer, openMillis, frames));
    }

    public static void logSendFailure(String peer, Throwable error) {
        log.log(Level.WARNING, "failed to send frame to " + peer, error);
    }
}
