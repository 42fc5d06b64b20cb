// file: sync/src/main/java/io/leafsync/sync/proto/SyncBinaryClient.java
package io.leafsync.sync.proto;

import io.leafsync.core.EntityId;
import io.leafsync.core.Subscription;
import io.leafsync.sync.Subscriber;
import io.leafsync.sync.SyncInterface;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Client side of the wire protocol: a {@link SyncInterface} on top of a {@link BinaryChannel}
 * whose other end is a {@link HubEndpoint}.
 */
public final class SyncBinaryClient implements SyncInterface {
    private static final Logger log = Logger.getLogger(SyncBinaryClient.class.getName());

    private final BinaryChannel channel;
    private final Map<EntityId, List<Subscriber>> subscribers = new ConcurrentHashMap<>();

    public SyncBinaryClient(BinaryChannel channel) {
        this.channel = channel;
        channel.setReceiver(this::receive);
    }

    @Override
    public Subscription subscribe(EntityId id, byte[] localVersion, Subscriber subscriber) {
        subscribers.computeIfAbsent(id, k -> new CopyOnWriteArrayList<>()).add(subscriber);
        send(new SyncMessage.Subscribe(id, localVersion));
        return Subscription.once(() -> {
            var now = subscribers.computeIfPresent(id, (k, subs) -> {
                subs.remove(subscriber);
                return subs.isEmpty() ? null : subs;
            });
            if (now == null) send(new SyncMessage.Unsubscribe(id));
        });
    }

    @Override
    public void sendUpdate(EntityId id, byte[] update) {
        send(new SyncMessage.SendUpdate(id, update));
    }

    private void send(SyncMessage message) {
        channel.send(MessageCodec.encode(message)).whenComplete((ok, err) -> {
            if (err != null) log.log(Level.WARNING, "failed to send " + message.getClass().getSimpleName()
                    + " for " + message.entityId(), err);
        });
    }

    private void receive(byte[] frame) {
        SyncMessage msg;
        try {
            msg = MessageCodec.decode(frame);
        } catch (MalformedMessageException e) {
            log.log(Level.WARNING, "dropping malformed frame from hub", e);
            return;
        }
        if (!(msg instanceof SyncMessage.HandleUpdate update)) {
            log.warning("unexpected " + msg.getClass().getSimpleName() + " from hub");
            return;
        }
        for (Subscriber s : subscribers.getOrDefault(update.entityId(), List.of())) {
            s.handleUpdate(update.entityId(), update.update());
        }
    }
}
