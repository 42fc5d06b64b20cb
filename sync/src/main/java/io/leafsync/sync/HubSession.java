// file: sync/src/main/java/io/leafsync/sync/HubSession.java
package io.leafsync.sync;

import io.leafsync.core.EntityId;
import io.leafsync.core.Subscription;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One client's connection to a {@link HubPeer}.
 * <p>
 * Behaves like the hub itself, except that updates this session sends are not relayed
 * back to this session's own subscribers. {@link #close()} drops every subscription made
 * through it.
 */
public final class HubSession implements SyncInterface, AutoCloseable {
    private final HubPeer hub;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    HubSession(HubPeer hub) {
        this.hub = hub;
    }

    @Override
    public Subscription subscribe(EntityId id, byte[] localVersion, Subscriber subscriber) {
        if (closed) throw new IllegalStateException("session closed");
        Subscription inner = hub.register(id, localVersion, subscriber, this);
        subscriptions.add(inner);
        return Subscription.once(() -> {
            subscriptions.remove(inner);
            inner.unsubscribe();
        });
    }

    @Override
    public void sendUpdate(EntityId id, byte[] update) {
        if (closed) throw new IllegalStateException("session closed");
        hub.publish(id, update, this);
    }

    @Override
    public void close() {
        closed = true;
        for (Subscription s : subscriptions) s.unsubscribe();
        subscriptions.clear();
    }
}
