// file: sync/src/main/java/io/leafsync/sync/SyncEngine.java
package io.leafsync.sync;

import io.leafsync.core.Entity;
import io.leafsync.core.EntityId;
import io.leafsync.core.Subscription;
import io.leafsync.core.VersionVector;
import io.leafsync.core.doc.Document;
import io.leafsync.core.doc.DocumentCodec;
import io.leafsync.core.doc.DocumentFormatException;
import io.leafsync.core.doc.UpdateHeader;
import io.leafsync.core.task.TaskQueue;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps entities in sync with one {@link SyncInterface}.
 * <p>
 * Per synced entity:
 *   - local commits are forwarded to the remote side on the next turn of the task queue,
 *     never from inside the document callback,
 *   - remote updates are merged on the task queue,
 *   - if after a merge we know changes the sender did not, we send them back as a delta.
 * <p>
 * Anti-entropy is implicit: the subscribe request carries our version, so the remote side
 * answers with exactly what we are missing, and the send-back rule covers the reverse.
 */
public final class SyncEngine {
    private static final Logger log = Logger.getLogger(SyncEngine.class.getName());

    private final SyncInterface remote;
    private final TaskQueue queue;
    private final Map<EntityId, Session> sessions = new ConcurrentHashMap<>();

    public SyncEngine(SyncInterface remote, TaskQueue queue) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.queue = Objects.requireNonNull(queue, "queue");
    }

    /**
     * Start syncing {@code entity}. Idempotent per entity id.
     *
     * @return completes when the first valid remote update for the entity has been applied.
     */
    public CompletableFuture<Void> sync(Entity entity) {
        var fresh = new Session(entity);
        Session existing = sessions.putIfAbsent(entity.id(), fresh);
        if (existing != null) return existing.initialLoad;
        fresh.start();
        return fresh.initialLoad;
    }

    /** Stop syncing {@code id}. Safe to call for ids that are not synced. */
    public void unsync(EntityId id) {
        Session s = sessions.remove(id);
        if (s != null) s.stop();
    }

    public Optional<SyncState> state(EntityId id) {
        Session s = sessions.get(id);
        return s == null ? Optional.empty() : Optional.of(s.state);
    }

    public boolean isSyncing(EntityId id) {
        return sessions.containsKey(id);
    }

    private final class Session {
        final Entity entity;
        final CompletableFuture<Void> initialLoad = new CompletableFuture<>();
        volatile SyncState state = SyncState.IDLE;
        private Subscription localSub = Subscription.noop();
        private Subscription remoteSub = Subscription.noop();

        Session(Entity entity) {
            this.entity = entity;
        }

        synchronized void start() {
            if (state != SyncState.IDLE) return;
            EntityId id = entity.id();
            Document doc = entity.doc();
            state = SyncState.SUBSCRIBING;
            localSub = doc.subscribeLocalUpdates(update -> queue.defer(() -> forward(update)));
            VersionVector version = doc.version();
            remoteSub = remote.subscribe(id, version.isEmpty() ? null : version.encode(),
                    (from, update) -> queue.defer(() -> receive(update)));
            log.fine(() -> "syncing " + id + " from version " + version);
        }

        synchronized void stop() {
            state = SyncState.STOPPED;
            localSub.unsubscribe();
            remoteSub.unsubscribe();
            log.fine(() -> "stopped syncing " + entity.id());
        }

        private void forward(byte[] update) {
            if (state == SyncState.STOPPED) return;
            remote.sendUpdate(entity.id(), update);
        }

        private void receive(byte[] update) {
            if (state == SyncState.STOPPED) return;
            if (entity.isFreed()) {
                unsync(entity.id());
                return;
            }
            Document doc = entity.doc();
            UpdateHeader header;
            try {
                header = DocumentCodec.readHeader(update);
                doc.merge(update);
            } catch (DocumentFormatException e) {
                log.log(Level.WARNING, "dropping malformed update for " + entity.id(), e);
                return;
            }
            if (state == SyncState.SUBSCRIBING) state = SyncState.ACTIVE;
            initialLoad.complete(null);

            VersionVector local = doc.version();
            if (Document.compareVersions(header.end(), local).rightHasNews()) {
                log.fine(() -> "sending back changes for " + entity.id() + " missing from " + header.end());
                remote.sendUpdate(entity.id(), doc.exportDelta(header.end()));
            }
        }
    }
}
