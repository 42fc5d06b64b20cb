// file: sync/src/test/java/io/leafsync/peer/LocalPeerTest.java
package io.leafsync.peer;

import io.leafsync.core.Entity;
import io.leafsync.core.EntityId;
import io.leafsync.core.task.EventLoop;
import io.leafsync.storage.MemoryStorage;
import io.leafsync.storage.StorageConfig;
import io.leafsync.storage.StorageKey;
import io.leafsync.storage.StorageManager;
import io.leafsync.storage.WriteThrottle;
import io.leafsync.sync.Await;
import io.leafsync.sync.HubPeer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Peers opening, editing and closing entities, alone and through a hub.
 */
class LocalPeerTest {

    private final List<EventLoop> loops = new ArrayList<>();
    private final EventLoop hubLoop = loop("hub");
    private final HubPeer hub = new HubPeer(hubLoop, new StorageManager(new MemoryStorage()));

    @AfterEach
    void tearDown() {
        loops.forEach(EventLoop::close);
    }

    private EventLoop loop(String name) {
        var l = new EventLoop(name);
        loops.add(l);
        return l;
    }

    private static <T> T await(CompletableFuture<T> f) throws Exception {
        return f.get(5, TimeUnit.SECONDS);
    }

    private LocalPeer syncedPeer(String name, MemoryStorage local) {
        return new LocalPeer(loop(name), PeerConfig.builder()
                .storage(local)
                .sync(hub.connect())
                .build());
    }

    @Test
    void two_peers_converge_through_one_hub() throws Exception {
        var a = syncedPeer("peer-a", new MemoryStorage());
        var b = syncedPeer("peer-b", new MemoryStorage());

        EntityHandle onA = await(a.create());
        Entity entA = onA.entity();
        entA.map("name").put("first", "John");
        entA.counter("visits").increment(1);
        entA.commit();

        EntityHandle onB = await(b.open(entA.id()));
        Entity entB = onB.entity();
        Await.until(() -> entB.map("name").get("first").isPresent(), "peer b to see peer a's edit");
        entB.counter("visits").increment(1);
        entB.commit();

        Await.until(() -> entA.counter("visits").value() == 2, "peer a to see peer b's increment");
        Await.until(() -> entB.doc().version().equals(entA.doc().version()), "versions to match");

        assertEquals("John", entB.map("name").get("first").orElseThrow());
        assertEquals(2, entB.counter("visits").value());
        assertArrayEquals(entA.doc().exportSnapshot(), entB.doc().exportSnapshot());
    }

    @Test
    void entity_found_in_local_storage_opens_without_a_remote_answer() throws Exception {
        var local = new MemoryStorage();
        var stored = new Entity();
        stored.map("name").put("first", "Ada");
        stored.commit();
        new StorageManager(local).save(stored);

        // The hub knows nothing, so only local storage can satisfy the open.
        var peer = syncedPeer("peer", local);
        EntityHandle h = await(peer.open(stored.id()));

        assertEquals("Ada", h.entity().map("name").get("first").orElseThrow());
    }

    @Test
    void edits_are_saved_to_local_storage() throws Exception {
        var local = new MemoryStorage();
        var peer = new LocalPeer(loop("peer"), PeerConfig.builder().storage(local).build());

        EntityHandle h = await(peer.create());
        h.entity().counter("visits").increment(3);
        h.entity().commit();
        EntityId id = h.id();
        h.close();
        Await.until(() -> !peer.isOpen(id), "entity to close");

        var restored = new Entity(id);
        assertTrue(new StorageManager(local).load(restored));
        assertEquals(3, restored.counter("visits").value());
    }

    @Test
    void open_without_any_copy_waits_for_create_after_timeout() throws Exception {
        var peer = syncedPeer("peer", new MemoryStorage());
        var id = EntityId.random();

        CompletableFuture<EntityHandle> waiting = peer.open(id);
        CompletableFuture<EntityHandle> timed = peer.open(id, OpenOptions.createAfter(Duration.ofMillis(100)));

        EntityHandle h = await(timed);
        assertTrue(h.entity().doc().version().isEmpty());
        // Both opens share the entity, so the first one is released too.
        assertSame(h.entity(), await(waiting).entity());
        assertEquals(2, peer.handleCount(id));
    }

    @Test
    void open_with_no_syncers_creates_immediately() throws Exception {
        var peer = new LocalPeer(loop("peer"), PeerConfig.builder().build());
        EntityHandle h = await(peer.open(EntityId.random()));
        assertTrue(h.entity().doc().version().isEmpty());
    }

    @Test
    void late_opener_catches_up_from_the_hub() throws Exception {
        var a = syncedPeer("peer-a", new MemoryStorage());
        EntityHandle onA = await(a.create());
        onA.entity().map("name").put("first", "John");
        onA.entity().commit();
        EntityId id = onA.id();
        await(a.close(id));

        var b = syncedPeer("peer-b", new MemoryStorage());
        Await.until(() -> hub.subscriberCount(id) == 0, "peer a to unsubscribe");
        EntityHandle onB = await(b.open(id));

        Await.until(() -> onB.entity().map("name").get("first").isPresent(), "catch-up");
        assertEquals("John", onB.entity().map("name").get("first").orElseThrow());
    }

    @Test
    void close_commits_and_flushes_throttled_saves() throws Exception {
        var local = new MemoryStorage();
        var peerLoop = loop("peer");
        var throttled = StorageConfig.of(local).withThrottle(WriteThrottle.debounce(Duration.ofMinutes(10), peerLoop));
        var peer = new LocalPeer(peerLoop, PeerConfig.builder().storage(throttled).build());

        EntityHandle h = await(peer.create());
        h.entity().map("name").put("first", "Grace");
        h.entity().commit();
        h.entity().counter("visits").increment(1);
        // left uncommitted on purpose: close commits it
        EntityId id = h.id();
        await(peer.close(id));

        assertFalse(peer.isOpen(id));
        var restored = new Entity(id);
        assertTrue(new StorageManager(local).load(restored));
        assertEquals("Grace", restored.map("name").get("first").orElseThrow());
        assertEquals(1, restored.counter("visits").value());
        assertThrows(IllegalStateException.class, () -> h.entity().map("name").get("first"));
    }

    @Test
    void delete_removes_the_entity_from_local_storage() throws Exception {
        var local = new MemoryStorage();
        var peer = new LocalPeer(loop("peer"), PeerConfig.builder().storage(local).build());
        EntityHandle h = await(peer.create());
        h.entity().counter("n").increment(1);
        h.entity().commit();
        EntityId id = h.id();
        Await.until(() -> !new StoredChunks(local).isEmpty(id), "first save");

        await(peer.delete(id));

        assertFalse(peer.isOpen(id));
        assertTrue(new StoredChunks(local).isEmpty(id));
        assertTrue(h.entity().isFreed());
    }

    @Test
    void read_only_storage_is_loaded_but_never_written() throws Exception {
        var archive = new MemoryStorage();
        var seeded = new Entity();
        seeded.map("name").put("first", "Ada");
        seeded.commit();
        new StorageManager(archive).save(seeded);

        var local = new MemoryStorage();
        var peer = new LocalPeer(loop("peer"), PeerConfig.builder()
                .storage(StorageConfig.of(archive).readOnly())
                .storage(local)
                .build());

        EntityHandle h = await(peer.open(seeded.id()));
        assertEquals("Ada", h.entity().map("name").get("first").orElseThrow());
        h.entity().map("name").put("last", "Lovelace");
        h.entity().commit();
        await(peer.close(seeded.id()));

        var fromArchive = new Entity(seeded.id());
        assertTrue(new StorageManager(archive).load(fromArchive));
        assertEquals(seeded.doc().version(), fromArchive.doc().version());
        assertTrue(fromArchive.map("name").get("last").isEmpty());

        var fromLocal = new Entity(seeded.id());
        assertTrue(new StorageManager(local).load(fromLocal));
        assertEquals("Ada", fromLocal.map("name").get("first").orElseThrow());
        assertEquals("Lovelace", fromLocal.map("name").get("last").orElseThrow());

        await(peer.delete(seeded.id()));
        assertTrue(new StoredChunks(local).isEmpty(seeded.id()));
        assertFalse(new StoredChunks(archive).isEmpty(seeded.id()));
    }

    @Test
    void write_only_storage_is_written_but_not_consulted_on_open() throws Exception {
        var journal = new MemoryStorage();
        var seeded = new Entity();
        seeded.map("name").put("first", "Ada");
        seeded.commit();
        new StorageManager(journal).save(seeded);

        var peer = new LocalPeer(loop("peer"), PeerConfig.builder()
                .storage(StorageConfig.of(journal).writeOnly())
                .build());

        EntityHandle h = await(peer.open(seeded.id()));
        assertTrue(h.entity().doc().version().isEmpty());
        assertTrue(h.entity().map("name").get("first").isEmpty());

        h.entity().counter("visits").increment(1);
        h.entity().commit();
        await(peer.close(seeded.id()));

        var written = new Entity(seeded.id());
        assertTrue(new StorageManager(journal).load(written));
        assertEquals(1, written.counter("visits").value());
    }

    @Test
    void close_all_flushes_and_unloads_every_open_entity() throws Exception {
        var local = new MemoryStorage();
        var peerLoop = loop("peer");
        var throttled = StorageConfig.of(local).withThrottle(WriteThrottle.debounce(Duration.ofMinutes(10), peerLoop));
        var peer = new LocalPeer(peerLoop, PeerConfig.builder().storage(throttled).build());

        EntityHandle first = await(peer.create());
        EntityHandle second = await(peer.create());
        first.entity().counter("n").increment(1);
        first.entity().commit();
        second.entity().counter("n").increment(2);
        second.entity().commit();

        await(peer.closeAll());

        assertEquals(0, peer.openCount());
        assertTrue(first.entity().isFreed());
        var one = new Entity(first.id());
        var two = new Entity(second.id());
        assertTrue(new StorageManager(local).load(one));
        assertTrue(new StorageManager(local).load(two));
        assertEquals(1, one.counter("n").value());
        assertEquals(2, two.counter("n").value());
    }

    @Test
    void handles_share_one_entity_and_the_last_release_closes_it() throws Exception {
        var peer = new LocalPeer(loop("peer"), PeerConfig.builder().build());
        EntityHandle first = await(peer.create());
        EntityHandle second = await(peer.open(first.id()));

        assertSame(first.entity(), second.entity());
        assertEquals(2, peer.handleCount(first.id()));

        first.close();
        first.close();
        Await.until(() -> peer.handleCount(first.id()) == 1, "one release");
        assertTrue(peer.isOpen(first.id()));
        assertThrows(IllegalStateException.class, first::entity);

        second.close();
        Await.until(() -> !peer.isOpen(first.id()), "last release to close the entity");
        assertEquals(0, peer.openCount());
    }

    @Test
    void reopening_within_idle_eviction_keeps_the_entity_loaded() throws Exception {
        var peer = new LocalPeer(loop("peer"), PeerConfig.builder().idleEviction(Duration.ofMillis(300)).build());
        EntityHandle first = await(peer.create());
        Entity ent = first.entity();
        EntityId id = first.id();

        first.close();
        EntityHandle again = await(peer.open(id));
        Thread.sleep(500);

        assertTrue(peer.isOpen(id));
        assertSame(ent, again.entity());
        assertFalse(ent.isFreed());

        again.close();
        Await.until(() -> !peer.isOpen(id), "idle eviction");
        assertTrue(ent.isFreed());
    }

    /** Looks at a MemoryStorage the way a StorageManager lays it out. */
    private static final class StoredChunks {
        private final MemoryStorage storage;

        StoredChunks(MemoryStorage storage) {
            this.storage = storage;
        }

        boolean isEmpty(EntityId id) {
            return storage.loadRange(StorageKey.of("data", id.toString())).isEmpty();
        }
    }
}
