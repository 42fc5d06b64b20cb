// file: sync/src/main/java/io/leafsync/peer/LocalPeer.java
package io.leafsync.peer;

import io.leafsync.core.Entity;
import io.leafsync.core.EntityId;
import io.leafsync.core.task.TaskQueue;
import io.leafsync.storage.StorageConfig;
import io.leafsync.sync.SyncEngine;
import io.leafsync.sync.SyncInterface;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An application's entry point: opens entities, keeps them persisted to the configured
 * storages and in sync through the configured syncers, and closes them again.
 * <p>
 * Lifecycle of an entity:
 *   open -> load from readable storages -> start syncing -> save on every change
 *        -> (last handle released) -> commit, flush saves, stop syncing -> freed.
 * <p>
 * Threading: every method may be called from any thread. All state changes run on the
 * peer's {@link TaskQueue}; results are delivered through futures. Write throttles are
 * expected to run their writes on the same queue.
 */
public final class LocalPeer {
    private static final Logger log = Logger.getLogger(LocalPeer.class.getName());

    private final TaskQueue queue;
    private final PeerConfig config;
    private final List<SyncEngine> engines;
    private final EntityArena arena = new EntityArena();

    public LocalPeer(TaskQueue queue, PeerConfig config) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.config = Objects.requireNonNull(config, "config");
        var list = new ArrayList<SyncEngine>();
        for (SyncInterface s : config.syncers()) list.add(new SyncEngine(s, queue));
        this.engines = List.copyOf(list);
    }

    public PeerConfig config() { return config; }

    /** Open with {@link OpenOptions#defaults()}. */
    public CompletableFuture<EntityHandle> open(EntityId id) {
        return open(id, OpenOptions.defaults());
    }

    /**
     * Open {@code id}, or get another handle if it is already open.
     * <p>
     * An entity found in local storage is handed out right away. Otherwise the future
     * waits for the first update from any syncer, or for {@code createAfterTimeout}, after
     * which an empty entity is handed out. With no syncers there is nothing to wait for.
     */
    public CompletableFuture<EntityHandle> open(EntityId id, OpenOptions options) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(options, "options");
        var result = new CompletableFuture<EntityHandle>();
        queue.defer(() -> openOnQueue(id, options, result));
        return result;
    }

    /** Create and open a new entity with a random id. */
    public CompletableFuture<EntityHandle> create() {
        var result = new CompletableFuture<EntityHandle>();
        queue.defer(() -> {
            Entity entity = new Entity();
            EntityArena.Slot slot = arena.add(entity);
            slot.refs = 1;
            attach(slot);
            slot.ready.complete(entity);
            log.fine(() -> "created " + entity.id());
            result.complete(new EntityHandle(this, slot));
        });
        return result;
    }

    /**
     * Close {@code id} regardless of outstanding handles: commit pending edits, flush saves,
     * stop syncing and free the document. Completes immediately if it is not open.
     */
    public CompletableFuture<Void> close(EntityId id) {
        var done = new CompletableFuture<Void>();
        queue.defer(() -> {
            Optional<EntityArena.Slot> slot = arena.get(id);
            if (slot.isEmpty()) {
                done.complete(null);
            } else {
                propagate(closeSlot(slot.get()), done);
            }
        });
        return done;
    }

    /** Close every open entity. */
    public CompletableFuture<Void> closeAll() {
        var done = new CompletableFuture<Void>();
        queue.defer(() -> {
            var closing = new ArrayList<CompletableFuture<Void>>();
            for (EntityArena.Slot s : arena.all()) closing.add(closeSlot(s));
            propagate(CompletableFuture.allOf(closing.toArray(new CompletableFuture[0])), done);
        });
        return done;
    }

    /**
     * Unload {@code id} without saving and remove it from every writable storage.
     * Remote copies are left alone.
     */
    public CompletableFuture<Void> delete(EntityId id) {
        var done = new CompletableFuture<Void>();
        queue.defer(() -> {
            arena.get(id).ifPresent(slot -> {
                slot.closing = true;
                cancelEviction(slot);
                for (SaveLane lane : slot.lanes) lane.drain().forEach(f -> f.complete(null));
                unload(slot, null);
            });
            try {
                for (StorageConfig s : config.storages()) {
                    if (s.write()) s.manager().delete(id);
                }
                log.fine(() -> "deleted " + id);
                done.complete(null);
            } catch (RuntimeException e) {
                done.completeExceptionally(e);
            }
        });
        return done;
    }

    /** True while {@code id} is loaded. */
    public boolean isOpen(EntityId id) {
        return arena.contains(id);
    }

    /** Outstanding handles for {@code id}. */
    public int handleCount(EntityId id) {
        return arena.refs(id);
    }

    public int openCount() {
        return arena.size();
    }

    // ---------- queue-side ----------

    void release(EntityArena.Slot slot) {
        queue.defer(() -> {
            if (slot.closing || slot.unloaded()) return;
            slot.refs--;
            if (slot.refs > 0) return;
            Duration idle = config.idleEviction();
            if (idle == null) {
                closeSlot(slot);
            } else {
                slot.eviction = queue.schedule(() -> {
                    if (slot.refs == 0 && !slot.closing) closeSlot(slot);
                }, idle);
            }
        });
    }

    private void openOnQueue(EntityId id, OpenOptions options, CompletableFuture<EntityHandle> result) {
        Optional<EntityArena.Slot> existing = arena.get(id);
        if (existing.isPresent()) {
            EntityArena.Slot slot = existing.get();
            if (slot.closing) {
                // Reopen once the current close has finished.
                slot.closed.whenComplete((r, e) -> queue.defer(() -> openOnQueue(id, options, result)));
                return;
            }
            slot.refs++;
            cancelEviction(slot);
            if (!slot.ready.isDone()) options.timeout().ifPresent(t -> createAfter(slot, t));
            handOut(slot, result);
            return;
        }

        Entity entity = new Entity(id);
        EntityArena.Slot slot = arena.add(entity);
        slot.refs = 1;

        boolean found = false;
        try {
            for (StorageConfig s : config.storages()) {
                if (s.read() && s.manager().load(entity)) found = true;
            }
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "failed to load " + id, e);
            arena.remove(slot);
            entity.free();
            slot.closed.complete(null);
            slot.ready.completeExceptionally(e);
            result.completeExceptionally(e);
            return;
        }

        List<CompletableFuture<Void>> initialLoads = attach(slot);
        if (found || initialLoads.isEmpty()) {
            slot.ready.complete(entity);
        } else {
            CompletableFuture.anyOf(initialLoads.toArray(new CompletableFuture[0]))
                    .whenComplete((r, e) -> queue.defer(() -> slot.ready.complete(entity)));
            options.timeout().ifPresent(t -> createAfter(slot, t));
        }
        boolean local = found;
        log.fine(() -> "opened " + id + (local ? " from local storage" : ""));
        handOut(slot, result);
    }

    private void createAfter(EntityArena.Slot slot, Duration timeout) {
        queue.schedule(() -> {
            if (!slot.unloaded() && slot.ready.complete(slot.entity)) {
                log.fine(() -> "no remote copy of " + slot.entity.id() + " within " + timeout + ", created empty");
            }
        }, timeout);
    }

    private List<CompletableFuture<Void>> attach(EntityArena.Slot slot) {
        for (StorageConfig s : config.storages()) {
            if (s.write()) slot.lanes.add(new SaveLane(s));
        }
        slot.changes = slot.entity.doc().subscribe(event -> queue.defer(() -> scheduleSaves(slot)));
        var initialLoads = new ArrayList<CompletableFuture<Void>>(engines.size());
        for (SyncEngine engine : engines) initialLoads.add(engine.sync(slot.entity));
        return initialLoads;
    }

    private void handOut(EntityArena.Slot slot, CompletableFuture<EntityHandle> result) {
        slot.ready.whenComplete((entity, err) -> {
            if (err != null) {
                result.completeExceptionally(err);
            } else {
                result.complete(new EntityHandle(this, slot));
            }
        });
    }

    private void scheduleSaves(EntityArena.Slot slot) {
        if (slot.unloaded()) return;
        for (SaveLane lane : slot.lanes) {
            lane.request();
            lane.throttle.submit(() -> runSave(slot, lane));
        }
    }

    private void runSave(EntityArena.Slot slot, SaveLane lane) {
        List<CompletableFuture<Void>> waiting = lane.drain();
        if (waiting.isEmpty() || slot.entity.isFreed()) {
            waiting.forEach(f -> f.complete(null));
            return;
        }
        try {
            lane.storage.manager().save(slot.entity);
            waiting.forEach(f -> f.complete(null));
        } catch (RuntimeException e) {
            // The entity stays dirty; the next change retries.
            log.log(Level.WARNING, "failed to save " + slot.entity.id(), e);
            waiting.forEach(f -> f.completeExceptionally(e));
        }
    }

    private CompletableFuture<Void> closeSlot(EntityArena.Slot slot) {
        if (slot.closing) return slot.closed;
        slot.closing = true;
        cancelEviction(slot);
        queue.defer(() -> {
            try {
                if (!slot.entity.isFreed()) slot.entity.commit();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "commit on close failed for " + slot.entity.id(), e);
            }
            // A second turn lets the work deferred by the commit (forwarding, save scheduling) run first.
            queue.defer(() -> flushAndUnload(slot));
        });
        return slot.closed;
    }

    private void flushAndUnload(EntityArena.Slot slot) {
        RuntimeException failure = null;
        for (SaveLane lane : slot.lanes) {
            List<CompletableFuture<Void>> waiting = lane.drain();
            if (waiting.isEmpty()) continue;
            try {
                lane.storage.manager().save(slot.entity);
                waiting.forEach(f -> f.complete(null));
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "final save failed for " + slot.entity.id(), e);
                waiting.forEach(f -> f.completeExceptionally(e));
                failure = e;
            }
        }
        unload(slot, failure);
    }

    private void unload(EntityArena.Slot slot, RuntimeException failure) {
        EntityId id = slot.entity.id();
        slot.changes.unsubscribe();
        for (SyncEngine engine : engines) engine.unsync(id);
        arena.remove(slot);
        slot.entity.free();
        slot.ready.completeExceptionally(new IllegalStateException(id + " was closed before it became ready"));
        if (failure == null) {
            slot.closed.complete(null);
        } else {
            slot.closed.completeExceptionally(failure);
        }
        log.fine(() -> "closed " + id);
    }

    private static void cancelEviction(EntityArena.Slot slot) {
        if (slot.eviction != null) {
            slot.eviction.cancel(false);
            slot.eviction = null;
        }
    }

    private static void propagate(CompletableFuture<Void> from, CompletableFuture<Void> to) {
        from.whenComplete((r, e) -> {
            if (e != null) to.completeExceptionally(e); else to.complete(null);
        });
    }
}
