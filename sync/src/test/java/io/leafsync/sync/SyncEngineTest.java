// file: sync/src/test/java/io/leafsync/sync/SyncEngineTest.java
package io.leafsync.sync;

import io.leafsync.core.Entity;
import io.leafsync.core.EntityId;
import io.leafsync.core.Subscription;
import io.leafsync.core.VersionVector;
import io.leafsync.core.task.EventLoop;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SyncEngine against a scripted remote side.
 */
class SyncEngineTest {

    /** Remote side that records calls and lets the test push updates. */
    static final class FakeRemote implements SyncInterface {
        final List<byte[]> subscribedVersions = new CopyOnWriteArrayList<>();
        final List<byte[]> sent = new CopyOnWriteArrayList<>();
        final List<String> sendThreads = new CopyOnWriteArrayList<>();
        final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();
        final AtomicInteger unsubscribed = new AtomicInteger();

        @Override
        public Subscription subscribe(EntityId id, byte[] localVersion, Subscriber subscriber) {
            subscribedVersions.add(localVersion);
            subscribers.add(subscriber);
            return Subscription.once(() -> {
                subscribers.remove(subscriber);
                unsubscribed.incrementAndGet();
            });
        }

        @Override
        public void sendUpdate(EntityId id, byte[] update) {
            sent.add(update);
            sendThreads.add(Thread.currentThread().getName());
        }

        void push(EntityId id, byte[] update) {
            for (Subscriber s : subscribers) s.handleUpdate(id, update);
        }
    }

    private final EventLoop loop = new EventLoop("engine-test");
    private final FakeRemote remote = new FakeRemote();
    private final SyncEngine engine = new SyncEngine(remote, loop);

    @AfterEach
    void tearDown() {
        loop.close();
    }

    private void settle() throws Exception {
        loop.barrier().get(5, TimeUnit.SECONDS);
    }

    @Test
    void subscribe_carries_the_local_version() {
        var ent = new Entity();
        ent.map("name").put("first", "John");
        ent.commit();

        engine.sync(ent);

        assertEquals(1, remote.subscribedVersions.size());
        assertEquals(ent.doc().version(), VersionVector.decode(remote.subscribedVersions.get(0)));
    }

    @Test
    void empty_entity_subscribes_without_a_version() {
        engine.sync(new Entity());
        assertNull(remote.subscribedVersions.get(0));
    }

    @Test
    void sync_is_idempotent() {
        var ent = new Entity();
        var first = engine.sync(ent);
        var second = engine.sync(ent);

        assertSame(first, second);
        assertEquals(1, remote.subscribers.size());
        assertEquals(SyncState.SUBSCRIBING, engine.state(ent.id()).orElseThrow());
    }

    @Test
    void local_commits_are_forwarded_from_the_task_queue() throws Exception {
        var ent = new Entity();
        engine.sync(ent);

        ent.counter("visits").increment(1);
        ent.commit();
        settle();

        assertEquals(1, remote.sent.size());
        assertEquals(List.of("engine-test"), remote.sendThreads);
        var copy = new Entity(ent.id());
        copy.doc().merge(remote.sent.get(0));
        assertEquals(1, copy.counter("visits").value());
    }

    @Test
    void first_valid_update_completes_the_initial_load() throws Exception {
        var source = new Entity();
        source.map("name").put("first", "John");
        source.commit();
        var ent = new Entity(source.id());
        var initial = engine.sync(ent);

        remote.push(ent.id(), new byte[]{1, 2, 3});
        settle();
        assertFalse(initial.isDone());
        assertEquals(SyncState.SUBSCRIBING, engine.state(ent.id()).orElseThrow());

        remote.push(ent.id(), source.doc().exportSnapshot());
        initial.get(5, TimeUnit.SECONDS);

        assertEquals("John", ent.map("name").get("first").orElseThrow());
        assertEquals(SyncState.ACTIVE, engine.state(ent.id()).orElseThrow());
        assertTrue(remote.sent.isEmpty(), "nothing to send back when versions match");
    }

    @Test
    void changes_the_sender_lacks_are_sent_back() throws Exception {
        var ent = new Entity();
        ent.map("name").put("first", "Ada");
        ent.commit();
        engine.sync(ent);

        // The remote side knows nothing about this entity yet.
        byte[] empty = new Entity(ent.id()).doc().exportDelta(VersionVector.empty());
        remote.push(ent.id(), empty);
        settle();

        assertEquals(1, remote.sent.size());
        var remoteCopy = new Entity(ent.id());
        remoteCopy.doc().merge(remote.sent.get(0));
        assertEquals("Ada", remoteCopy.map("name").get("first").orElseThrow());
    }

    @Test
    void unsync_stops_forwarding_and_is_idempotent() throws Exception {
        var ent = new Entity();
        engine.sync(ent);

        engine.unsync(ent.id());
        engine.unsync(ent.id());
        engine.unsync(EntityId.random());

        ent.counter("n").increment(1);
        ent.commit();
        settle();

        assertTrue(remote.sent.isEmpty());
        assertEquals(1, remote.unsubscribed.get());
        assertFalse(engine.isSyncing(ent.id()));
    }

    @Test
    void freed_entity_unsyncs_itself_on_next_delivery() throws Exception {
        var ent = new Entity();
        engine.sync(ent);
        ent.free();

        remote.push(ent.id(), new Entity(ent.id()).doc().exportSnapshot());
        settle();

        assertFalse(engine.isSyncing(ent.id()));
        assertEquals(1, remote.unsubscribed.get());
    }
}
