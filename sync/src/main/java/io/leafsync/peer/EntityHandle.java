// file: sync/src/main/java/io/leafsync/peer/EntityHandle.java
package io.leafsync.peer;

import io.leafsync.core.Entity;
import io.leafsync.core.EntityId;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A counted reference to an entity opened by a {@link LocalPeer}.
 * <p>
 * Every successful open returns a new handle. The peer keeps the entity loaded, synced
 * and persisted while at least one handle is open. {@link #close()} releases this handle;
 * closing it again does nothing.
 */
public final class EntityHandle implements AutoCloseable {
    private final LocalPeer peer;
    private final EntityArena.Slot slot;
    private final AtomicBoolean released = new AtomicBoolean();

    EntityHandle(LocalPeer peer, EntityArena.Slot slot) {
        this.peer = peer;
        this.slot = slot;
    }

    public EntityId id() { return slot.entity.id(); }

    /**
     * The shared entity. Stays usable until the peer closes it.
     *
     * @throws IllegalStateException if this handle has been released.
     */
    public Entity entity() {
        if (released.get()) throw new IllegalStateException("handle for " + id() + " has been released");
        return slot.entity;
    }

    public boolean isReleased() { return released.get(); }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) peer.release(slot);
    }

    @Override public String toString() { return "EntityHandle(" + id() + ")"; }
}
