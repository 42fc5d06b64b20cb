// file: sync/src/main/java/io/leafsync/sync/HubPeer.java
package io.leafsync.sync;

import io.leafsync.core.CausalOrder;
import io.leafsync.core.Entity;
import io.leafsync.core.EntityId;
import io.leafsync.core.Subscription;
import io.leafsync.core.VersionVector;
import io.leafsync.core.doc.Document;
import io.leafsync.core.task.TaskQueue;
import io.leafsync.storage.StorageConfig;
import io.leafsync.storage.StorageManager;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hub ("super peer"): accepts subscriptions and updates for any entity, persists every
 * entity it learns about, and relays updates between subscribers.
 * <p>
 * The hub keeps no documents in memory. Each request loads the entity from the readable
 * storages into a fresh {@link Entity}, works on it and frees it again.
 * <p>
 * Update pipeline (per {@link #sendUpdate}):
 *   load -> remember version -> merge -> compare.
 *   Only when the version advanced is the entity saved and the update relayed, so
 *   duplicates and echoes die here.
 * <p>
 * Threading: calls may come from any thread; all work runs on the hub's task queue.
 */
public final class HubPeer implements SyncInterface {
    private static final Logger log = Logger.getLogger(HubPeer.class.getName());

    private final TaskQueue queue;
    private final List<StorageConfig> storages;
    private final Map<EntityId, List<Registration>> subscribers = new ConcurrentHashMap<>();

    public HubPeer(TaskQueue queue, List<StorageConfig> storages) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.storages = List.copyOf(storages);
    }

    public HubPeer(TaskQueue queue, StorageManager... managers) {
        this(queue, Arrays.stream(managers).map(StorageConfig::of).toList());
    }

    @Override
    public Subscription subscribe(EntityId id, byte[] callerVersion, Subscriber subscriber) {
        return register(id, callerVersion, subscriber, null);
    }

    @Override
    public void sendUpdate(EntityId id, byte[] update) {
        publish(id, update, null);
    }

    /**
     * Open a per-connection view of this hub. Updates sent through the session are not
     * echoed back to subscribers registered through the same session.
     */
    public HubSession connect() {
        return new HubSession(this);
    }

    /** Number of subscribers currently registered for {@code id}. */
    public int subscriberCount(EntityId id) {
        List<Registration> regs = subscribers.get(id);
        return regs == null ? 0 : regs.size();
    }

    Subscription register(EntityId id, byte[] callerVersion, Subscriber subscriber, HubSession owner) {
        var reg = new Registration(subscriber, owner);
        subscribers.computeIfAbsent(id, k -> new CopyOnWriteArrayList<>()).add(reg);
        log.fine(() -> "subscribe " + id);

        queue.defer(() -> answerSubscribe(id, callerVersion, reg));

        return Subscription.once(() -> {
            subscribers.computeIfPresent(id, (k, regs) -> {
                regs.remove(reg);
                return regs.isEmpty() ? null : regs;
            });
            log.fine(() -> "unsubscribe " + id);
        });
    }

    void publish(EntityId id, byte[] update, HubSession origin) {
        queue.defer(() -> applyUpdate(id, update, origin));
    }

    private void answerSubscribe(EntityId id, byte[] callerVersion, Registration reg) {
        if (!isRegistered(id, reg)) return;
        Entity ent = new Entity(id);
        try {
            boolean found = loadInto(ent);
            VersionVector caller = decodeVersion(id, callerVersion);
            Document doc = ent.doc();
            byte[] answer;
            if (found) {
                answer = caller == null ? doc.exportSnapshot() : doc.exportDelta(caller);
            } else if (caller != null && !caller.isEmpty()) {
                // Nothing stored yet: an empty delta prompts the caller to push its state.
                answer = doc.exportDelta(VersionVector.empty());
            } else {
                return;
            }
            reg.subscriber.handleUpdate(id, answer);
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "failed to answer subscription for " + id, e);
        } finally {
            ent.free();
        }
    }

    private void applyUpdate(EntityId id, byte[] update, HubSession origin) {
        Entity ent = new Entity(id);
        try {
            loadInto(ent);
            Document doc = ent.doc();
            VersionVector before = doc.version();
            doc.merge(update);
            VersionVector after = doc.version();
            if (Document.compareVersions(after, before) != CausalOrder.AFTER) {
                log.fine(() -> "update for " + id + " brought nothing new");
                return;
            }

            for (StorageConfig s : storages) {
                if (s.write()) s.manager().save(ent);
            }

            List<Registration> regs = subscribers.getOrDefault(id, List.of());
            int relayed = 0;
            for (Registration r : regs) {
                if (origin != null && r.owner == origin) continue;
                try {
                    r.subscriber.handleUpdate(id, update);
                    relayed++;
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "subscriber failed to take update for " + id, e);
                }
            }
            int n = relayed;
            log.fine(() -> "update for " + id + " advanced " + before + " -> " + after + ", relayed to " + n);
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "failed to apply update for " + id, e);
        } finally {
            ent.free();
        }
    }

    private boolean loadInto(Entity ent) {
        boolean found = false;
        for (StorageConfig s : storages) {
            if (s.read() && s.manager().load(ent)) found = true;
        }
        return found;
    }

    private static VersionVector decodeVersion(EntityId id, byte[] bytes) {
        if (bytes == null) return null;
        try {
            return VersionVector.decode(bytes);
        } catch (IllegalArgumentException e) {
            log.log(Level.WARNING, "ignoring undecodable caller version for " + id, e);
            return null;
        }
    }

    private boolean isRegistered(EntityId id, Registration reg) {
        List<Registration> regs = subscribers.get(id);
        return regs != null && regs.contains(reg);
    }

    private static final class Registration {
        final Subscriber subscriber;
        final HubSession owner;

        Registration(Subscriber subscriber, HubSession owner) {
            this.subscriber = subscriber;
            this.owner = owner;
        }
    }
}
