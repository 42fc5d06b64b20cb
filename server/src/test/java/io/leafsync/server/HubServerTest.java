// file: server/src/test/java/io/leafsync/server/HubServerTest.java
package io.leafsync.server;

import io.leafsync.core.EntityId;
import io.leafsync.core.task.EventLoop;
import io.leafsync.storage.MemoryStorage;
import io.leafsync.storage.StorageManager;
import io.leafsync.sync.HubPeer;
import io.leafsync.sync.proto.MessageCodec;
import io.leafsync.sync.proto.SyncMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the hub's HTTP and WebSocket surface.
 */
class HubServerTest {

    private EventLoop loop;
    private HubPeer hub;
    private HubServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        loop = new EventLoop("hub-server-test");
        hub = new HubPeer(loop, new StorageManager(new MemoryStorage()));
        server = new HubServer("127.0.0.1", 0, hub);
        server.start();
        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        server.stop();
        loop.close();
    }

    private URI uri(String scheme, String path) {
        return URI.create(scheme + "://127.0.0.1:" + server.port() + path);
    }

    @Test
    void health_endpoint_reports_ok() throws Exception {
        HttpResponse<String> resp = client.send(
                HttpRequest.newBuilder(uri("http", "/admin/health")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(200, resp.statusCode());
        assertTrue(resp.body().contains("\"status\":\"ok\""));
    }

    @Test
    void unknown_path_is_404() throws Exception {
        HttpResponse<String> resp = client.send(
                HttpRequest.newBuilder(uri("http", "/nope")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(404, resp.statusCode());
    }

    @Test
    void text_frames_get_one_explanation() throws Exception {
        var firstText = new CompletableFuture<String>();
        WebSocket ws = client.newWebSocketBuilder()
                .buildAsync(uri("ws", "/sync"), new WebSocket.Listener() {
                    @Override
                    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                        firstText.complete(data.toString());
                        webSocket.request(1);
                        return null;
                    }
                }).get(5, TimeUnit.SECONDS);

        ws.sendText("hello", true).get(5, TimeUnit.SECONDS);

        assertEquals(HubServer.TEXT_REPLY, firstText.get(5, TimeUnit.SECONDS));
        ws.abort();
    }

    @Test
    void closing_the_socket_drops_its_subscriptions() throws Exception {
        var id = EntityId.random();
        WebSocket ws = client.newWebSocketBuilder()
                .buildAsync(uri("ws", "/sync"), new WebSocket.Listener() { })
                .get(5, TimeUnit.SECONDS);

        byte[] subscribe = MessageCodec.encode(new SyncMessage.Subscribe(id, null));
        ws.sendBinary(ByteBuffer.wrap(subscribe), true).get(5, TimeUnit.SECONDS);
        awaitSubscribers(id, 1);

        ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(5, TimeUnit.SECONDS);
        awaitSubscribers(id, 0);
    }

    private void awaitSubscribers(EntityId id, int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (hub.subscriberCount(id) != expected) {
            if (System.nanoTime() > deadline) fail("expected " + expected + " subscriber(s), had " + hub.subscriberCount(id));
            Thread.sleep(10);
        }
    }
}
