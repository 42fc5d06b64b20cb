// file: server/src/main/java/io/leafsync/server/HubServer.java
package io.leafsync.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leafsync.sync.HubPeer;
import io.leafsync.sync.proto.HubEndpoint;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedBinaryMessage;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.xnio.Pooled;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * HTTP front of the hub.
 *
 * Path layout:
 *   - GET /admin/health   {"status":"ok"}
 *   - /sync               WebSocket upgrade; one {@link HubEndpoint} per connection
 *
 * Sync connections carry binary frames only. The first text frame on a connection gets a
 * one-line explanation back; text is otherwise ignored.
 */
public final class HubServer {
    static final String TEXT_REPLY =
            "This is a LeafSync hub. WebSocket messages should be binary. Text messages will be ignored.";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final HubPeer hub;

    public HubServer(String host, int port, HubPeer hub) {
        this.hub = hub;
        HttpHandler sync = Handlers.websocket(this::onConnect);

        this.server = Undertow.builder()
                .addHttpListener(port, host)
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();

                    if ("/sync".equals(path)) {
                        sync.handleRequest(exchange);
                        return;
                    }

                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                    if ("/admin/health".equals(path) && "GET".equals(method)) {
                        send(exchange, 200, Map.of("status", "ok"));
                        ConnectionLogger.logRequest(method, path, 200, 0);
                    } else {
                        send(exchange, 404, Map.of("error", "not found"));
                        ConnectionLogger.logRequest(method, path, 404, 0);
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    /** The bound port; useful when started on port 0. */
    public int port() {
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    private void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        String peer = String.valueOf(channel.getPeerAddress());
        long openedAt = System.currentTimeMillis();
        AtomicLong frames = new AtomicLong();
        AtomicBoolean toldAboutText = new AtomicBoolean();

        var endpoint = new HubEndpoint(hub);
        WebSocketCallback<Void> onSendError = new WebSocketCallback<>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                ConnectionLogger.logSendFailure(peer, throwable);
            }
        };
        endpoint.setReceiver(frame -> WebSockets.sendBinary(ByteBuffer.wrap(frame), channel, onSendError));

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullBinaryMessage(WebSocketChannel ch, BufferedBinaryMessage message) {
                Pooled<ByteBuffer[]> data = message.getData();
                try {
                    ByteBuffer merged = WebSockets.mergeBuffers(data.getResource());
                    byte[] frame = new byte[merged.remaining()];
                    merged.get(frame);
                    frames.incrementAndGet();
                    endpoint.send(frame);
                } finally {
                    data.free();
                }
            }

            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                if (toldAboutText.compareAndSet(false, true)) {
                    WebSockets.sendText(TEXT_REPLY, ch, onSendError);
                }
            }
        });
        channel.addCloseTask(ch -> {
            endpoint.cleanup();
            ConnectionLogger.logClosed(peer, System.currentTimeMillis() - openedAt, frames.get());
        });
        channel.resumeReceives();
        ConnectionLogger.logOpened(peer);
    }

    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
