// file: sync/src/main/java/io/leafsync/sync/proto/HubEndpoint.java
package io.leafsync.sync.proto;

import io.leafsync.core.EntityId;
import io.leafsync.core.Subscription;
import io.leafsync.sync.HubPeer;
import io.leafsync.sync.HubSession;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hub side of the wire protocol, one instance per client connection.
 * <p>
 * {@link #send} takes a frame from the client and turns it into a hub call; updates for
 * the client's subscriptions are encoded as {@link SyncMessage.HandleUpdate} frames and
 * handed to the receiver, which writes them to the connection.
 */
public final class HubEndpoint implements BinaryChannel {
    private static final Logger log = Logger.getLogger(HubEndpoint.class.getName());

    private final HubSession session;
    private final Map<EntityId, Subscription> subscriptions = new ConcurrentHashMap<>();
    private volatile Consumer<byte[]> receiver = frame -> { };

    public HubEndpoint(HubPeer hub) {
        this.session = hub.connect();
    }

    @Override
    public CompletableFuture<Void> send(byte[] clientFrame) {
        SyncMessage msg;
        try {
            msg = MessageCodec.decode(clientFrame);
        } catch (MalformedMessageException e) {
            log.log(Level.WARNING, "dropping malformed frame from client", e);
            return CompletableFuture.completedFuture(null);
        }

        if (msg instanceof SyncMessage.Subscribe s) {
            Subscription sub = session.subscribe(s.entityId(), s.version(), (id, update) ->
                    receiver.accept(MessageCodec.encode(new SyncMessage.HandleUpdate(id, update))));
            Subscription previous = subscriptions.put(s.entityId(), sub);
            if (previous != null) previous.unsubscribe();
        } else if (msg instanceof SyncMessage.Unsubscribe u) {
            Subscription sub = subscriptions.remove(u.entityId());
            if (sub != null) sub.unsubscribe();
        } else if (msg instanceof SyncMessage.SendUpdate u) {
            session.sendUpdate(u.entityId(), u.update());
        } else {
            log.warning("unexpected " + msg.getClass().getSimpleName() + " from client");
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void setReceiver(Consumer<byte[]> receiver) {
        this.receiver = receiver;
    }

    /** Number of entities this connection is subscribed to. */
    public int subscriptionCount() {
        return subscriptions.size();
    }

    /** Drop every subscription of this connection. Call when the connection closes. */
    public void cleanup() {
        subscriptions.clear();
        session.close();
    }
}
