// file: server/src/main/java/io/leafsync/server/ServerConfig.java
package io.leafsync.server;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leafsync.server.dto.ServerConfigJson;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Hub server configuration parsed from CLI args, optionally layered over a JSON file.
 *
 * Supports:
 *  - host:       interface the HTTP listener binds to
 *  - port:       HTTP port; the sync WebSocket lives at /sync on the same port
 *  - storage:    FILE persists entities under dataDir, MEMORY keeps them until shutdown
 *  - dataDir:    root directory of file storage
 *  - configPath: optional JSON file read before the flags are applied
 */
public record ServerConfig(
        String host,
        int port,
        StorageKind storage,
        String dataDir,
        String configPath
) {

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 8095;
    public static final String DEFAULT_DATA_DIR = "./data/leafsync";

    public enum StorageKind {
        FILE, MEMORY;

        static StorageKind parse(String s) {
            try {
                return valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid storage: " + s + " (expected file or memory)");
            }
        }
    }

    /**
     * CLI entry point: like {@link #parse(String[])} but prints the problem and exits on bad input.
     */
    public static ServerConfig fromArgs(String[] args) {
        try {
            return parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(1);
            return null; // unreachable
        }
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --host,     -H   <host>
     *   --port,     -p   <port>
     *   --storage,  -s   file|memory
     *   --data-dir, -d   <path>
     *   --config,   -c   <json file>
     *   --help,     -h
     *
     * Precedence: flags, then the JSON file, then defaults.
     *
     * @throws IllegalArgumentException on unknown flags, missing values or bad numbers.
     */
    public static ServerConfig parse(String[] args) {
        String host = null;
        Integer port = null;
        StorageKind storage = null;
        String dataDir = null;
        String configPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--host", "-H" -> {
                    ensureValue(args, i);
                    host = args[++i];
                }

                case "--port", "-p" -> {
                    ensureValue(args, i);
                    port = parsePort(args[++i]);
                }

                case "--storage", "-s" -> {
                    ensureValue(args, i);
                    storage = StorageKind.parse(args[++i]);
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (configPath != null) {
            ServerConfigJson file = readJson(Path.of(configPath));
            if (host == null) host = file.host;
            if (port == null && file.port != null) port = file.port;
            if (storage == null && file.storage != null) storage = StorageKind.parse(file.storage);
            if (dataDir == null) dataDir = file.dataDir;
        }

        return new ServerConfig(
                host != null ? host : DEFAULT_HOST,
                port != null ? port : DEFAULT_PORT,
                storage != null ? storage : StorageKind.FILE,
                dataDir != null ? dataDir : DEFAULT_DATA_DIR,
                configPath
        );
    }

    static ServerConfigJson readJson(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            return mapper.readValue(path.toFile(), ServerConfigJson.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load server config from " + path + ": " + e.getMessage(), e);
        }
    }

    private static int parsePort(String s) {
        try {
            int port = Integer.parseInt(s);
            if (port < 0 || port > 65535) throw new IllegalArgumentException("Invalid port: " + s);
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + s);
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: leafsync-server [options]

            Options:
              --host,     -H   Interface to bind (default: 0.0.0.0)
              --port,     -p   HTTP/WebSocket port (default: 8095)
              --storage,  -s   file | memory (default: file)
              --data-dir, -d   Directory for file storage (default: ./data/leafsync)
              --config,   -c   JSON config file; flags override its values (optional)
              --help,     -h   Show this help message

            Endpoints:
              GET /admin/health   health check
              /sync               WebSocket carrying binary sync frames
            """);
        System.exit(0);
    }
}
