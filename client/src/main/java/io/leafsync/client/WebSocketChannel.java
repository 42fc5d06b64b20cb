// file: client/src/main/java/io/leafsync/client/WebSocketChannel.java
package io.leafsync.client;

import io.leafsync.sync.proto.BinaryChannel;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BinaryChannel} over a JDK {@link WebSocket}, typically connected to a hub's /sync endpoint.
 * <p>
 * Inbound binary messages may arrive in fragments; they are reassembled before delivery.
 * Outbound messages are sent one after another, since the JDK WebSocket allows only one
 * outstanding send.
 */
public final class WebSocketChannel implements BinaryChannel, AutoCloseable {
    private static final Logger log = Logger.getLogger(WebSocketChannel.class.getName());

    private final WebSocket socket;
    private final Inbound inbound;
    private CompletableFuture<Void> sendChain = CompletableFuture.completedFuture(null);

    private WebSocketChannel(WebSocket socket, Inbound inbound) {
        this.socket = socket;
        this.inbound = inbound;
    }

    /** Open a connection to {@code uri}, e.g. {@code ws://localhost:8095/sync}. */
    public static CompletableFuture<WebSocketChannel> connect(HttpClient http, URI uri) {
        var inbound = new Inbound(uri);
        return http.newWebSocketBuilder()
                .buildAsync(uri, inbound)
                .thenApply(ws -> {
                    log.info(() -> "connected to " + uri);
                    return new WebSocketChannel(ws, inbound);
                });
    }

    @Override
    public synchronized CompletableFuture<Void> send(byte[] message) {
        CompletableFuture<Void> sent = sendChain
                .thenCompose(v -> socket.sendBinary(ByteBuffer.wrap(message), true))
                .thenApply(ws -> null);
        // A failed send must not block the ones queued after it.
        sendChain = sent.exceptionally(e -> null);
        return sent;
    }

    @Override
    public void setReceiver(Consumer<byte[]> receiver) {
        inbound.receiver = receiver;
    }

    /** Resolves once the remote side has closed the connection or it failed. */
    public CompletableFuture<Void> closed() {
        return inbound.closed;
    }

    /** Send a normal close after everything queued so far has been sent. */
    @Override
    public void close() {
        CompletableFuture<Void> pending;
        synchronized (this) {
            pending = sendChain;
        }
        pending.thenCompose(v -> socket.sendClose(WebSocket.NORMAL_CLOSURE, "bye")).join();
    }

    private static final class Inbound implements WebSocket.Listener {
        private final URI uri;
        private final ByteArrayOutputStream partial = new ByteArrayOutputStream();
        private final CompletableFuture<Void> closed = new CompletableFuture<>();
        volatile Consumer<byte[]> receiver = frame -> { };

        Inbound(URI uri) {
            this.uri = uri;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            byte[] chunk = new byte[data.remaining()];
            data.get(chunk);
            partial.write(chunk, 0, chunk.length);
            if (last) {
                byte[] message = partial.toByteArray();
                partial.reset();
                try {
                    receiver.accept(message);
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "receiver failed for message from " + uri, e);
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            log.fine(() -> "ignoring text from " + uri + ": " + data);
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.info(() -> "connection to " + uri + " closed (" + statusCode + " " + reason + ")");
            closed.complete(null);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.log(Level.WARNING, "connection to " + uri + " failed", error);
            closed.complete(null);
        }
    }
}
