// file: sync/src/main/java/io/leafsync/peer/EntityArena.java
package io.leafsync.peer;

import io.leafsync.core.Entity;
import io.leafsync.core.EntityId;
import io.leafsync.core.Subscription;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * Open entities of a {@link LocalPeer}, with their reference counts.
 * <p>
 * Mutated only on the peer's task queue; readable from any thread.
 */
final class EntityArena {

    /** Everything the peer tracks for one open entity. */
    static final class Slot {
        final Entity entity;
        /** Completes with the entity once it may be handed out. */
        final CompletableFuture<Entity> ready = new CompletableFuture<>();
        /** Completes once the entity has been unloaded. */
        final CompletableFuture<Void> closed = new CompletableFuture<>();
        final List<SaveLane> lanes = new ArrayList<>();
        volatile int refs;
        boolean closing;
        Subscription changes = Subscription.noop();
        Future<?> eviction;

        Slot(Entity entity) {
            this.entity = entity;
        }

        boolean unloaded() {
            return closed.isDone();
        }
    }

    private final Map<EntityId, Slot> slots = new ConcurrentHashMap<>();

    Optional<Slot> get(EntityId id) {
        return Optional.ofNullable(slots.get(id));
    }

    Slot add(Entity entity) {
        var slot = new Slot(entity);
        slots.put(entity.id(), slot);
        return slot;
    }

    /** Remove {@code slot} if it is still the one registered for its entity. */
    void remove(Slot slot) {
        slots.remove(slot.entity.id(), slot);
    }

    boolean contains(EntityId id) {
        return slots.containsKey(id);
    }

    int refs(EntityId id) {
        Slot s = slots.get(id);
        return s == null ? 0 : s.refs;
    }

    List<Slot> all() {
        return List.copyOf(slots.values());
    }

    int size() {
        return slots.size();
    }
}
