// file: server/src/main/java/io/leafsync/server/Main.java
package io.leafsync.server;

import io.leafsync.core.task.EventLoop;
import io.leafsync.storage.FileStorage;
import io.leafsync.storage.MemoryStorage;
import io.leafsync.storage.StorageBackend;
import io.leafsync.storage.StorageManager;
import io.leafsync.sync.HubPeer;

import java.nio.file.Path;

/**
 * Entry point for a LeafSync hub.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and the optional JSON file).
 *  - Wire storage backend -> StorageManager -> HubPeer -> HubServer.
 *  - Stop the server and the hub's event loop on shutdown.
 */
public final class Main {

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);

        // ------ Storage ------
        StorageBackend backend = switch (cfg.storage()) {
            case FILE -> new FileStorage(Path.of(cfg.dataDir()));
            case MEMORY -> new MemoryStorage();
        };
        var storage = new StorageManager(backend);

        // ------ Hub ------
        var loop = new EventLoop("leafsync-hub");
        var hub = new HubPeer(loop, storage);

        // ------ HTTP / WebSocket ------
        var web = new HubServer(cfg.host(), cfg.port(), hub);
        web.start();

        System.out.printf(
                "LeafSync hub listening on http://%s:%d (sync: ws://%s:%d/sync, storage: %s)%n",
                cfg.host(), web.port(), cfg.host(), web.port(),
                cfg.storage() == ServerConfig.StorageKind.FILE ? cfg.dataDir() : "memory"
        );

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            web.stop();
            loop.close();
        }));
    }
}
