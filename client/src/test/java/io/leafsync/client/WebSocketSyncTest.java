// file: client/src/test/java/io/leafsync/client/WebSocketSyncTest.java
package io.leafsync.client;

import io.leafsync.core.Entity;
import io.leafsync.core.task.EventLoop;
import io.leafsync.peer.EntityHandle;
import io.leafsync.peer.LocalPeer;
import io.leafsync.peer.PeerConfig;
import io.leafsync.server.HubServer;
import io.leafsync.storage.MemoryStorage;
import io.leafsync.storage.StorageManager;
import io.leafsync.sync.HubPeer;
import io.leafsync.sync.proto.SyncBinaryClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two peers syncing through a real hub server over WebSockets.
 */
class WebSocketSyncTest {

    private final List<AutoCloseable> cleanup = new ArrayList<>();
    private HubServer server;

    @BeforeEach
    void startHub() {
        var hubLoop = new EventLoop("hub");
        cleanup.add(hubLoop);
        server = new HubServer("127.0.0.1", 0, new HubPeer(hubLoop, new StorageManager(new MemoryStorage())));
        server.start();
    }

    @AfterEach
    void stopHub() throws Exception {
        // channels first, while the server can still answer the close handshake
        for (AutoCloseable c : cleanup) c.close();
        server.stop();
    }

    private LocalPeer connectedPeer(String name) throws Exception {
        var channel = WebSocketChannel.connect(HttpClient.newHttpClient(),
                        URI.create("ws://127.0.0.1:" + server.port() + "/sync"))
                .get(5, TimeUnit.SECONDS);
        var loop = new EventLoop(name);
        cleanup.add(0, loop);
        cleanup.add(0, channel);
        return new LocalPeer(loop, PeerConfig.builder()
                .storage(new MemoryStorage())
                .sync(new SyncBinaryClient(channel))
                .build());
    }

    private static <T> T await(CompletableFuture<T> f) throws Exception {
        return f.get(10, TimeUnit.SECONDS);
    }

    private static void eventually(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) fail("timed out waiting for " + what);
            Thread.sleep(10);
        }
    }

    @Test
    void peers_converge_over_websockets() throws Exception {
        LocalPeer a = connectedPeer("peer-a");
        LocalPeer b = connectedPeer("peer-b");

        EntityHandle onA = await(a.create());
        Entity entA = onA.entity();
        entA.map("name").put("first", "John");
        entA.counter("visits").increment(1);
        entA.commit();

        Entity entB = await(b.open(entA.id())).entity();
        eventually(() -> entB.map("name").get("first").isPresent(), "peer b to receive the map");

        entB.counter("visits").increment(1);
        entB.commit();

        eventually(() -> entA.counter("visits").value() == 2, "peer a to receive the increment");
        eventually(() -> entA.doc().version().equals(entB.doc().version()), "versions to match");
        assertEquals("John", entB.map("name").get("first").orElseThrow());
        assertArrayEquals(entA.doc().exportSnapshot(), entB.doc().exportSnapshot());
    }
}
