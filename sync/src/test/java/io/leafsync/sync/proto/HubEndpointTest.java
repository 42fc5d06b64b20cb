// file: sync/src/test/java/io/leafsync/sync/proto/HubEndpointTest.java
package io.leafsync.sync.proto;

import io.leafsync.core.Entity;
import io.leafsync.core.task.EventLoop;
import io.leafsync.storage.MemoryStorage;
import io.leafsync.storage.StorageManager;
import io.leafsync.sync.Await;
import io.leafsync.sync.HubPeer;
import io.leafsync.sync.SyncEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Client and hub talking through encoded frames, with the endpoint standing in for a socket.
 */
class HubEndpointTest {

    private final EventLoop hubLoop = new EventLoop("hub");
    private final EventLoop clientLoop = new EventLoop("client");
    private final HubPeer hub = new HubPeer(hubLoop, new StorageManager(new MemoryStorage()));

    @AfterEach
    void tearDown() {
        clientLoop.close();
        hubLoop.close();
    }

    @Test
    void two_clients_converge_through_frames() throws Exception {
        var a = new SyncEngine(new SyncBinaryClient(new HubEndpoint(hub)), clientLoop);
        var b = new SyncEngine(new SyncBinaryClient(new HubEndpoint(hub)), clientLoop);

        var original = new Entity();
        var replica = new Entity(original.id());
        a.sync(original);
        b.sync(replica);

        original.map("name").put("first", "John");
        original.counter("visits").increment(1);
        original.commit();

        Await.until(() -> replica.map("name").get("first").isPresent(), "replica to receive the edit");
        assertEquals(1, replica.counter("visits").value());
        assertEquals(original.doc().version(), replica.doc().version());
    }

    @Test
    void malformed_client_frame_is_dropped_and_the_endpoint_keeps_working() throws Exception {
        var endpoint = new HubEndpoint(hub);
        List<byte[]> out = new CopyOnWriteArrayList<>();
        endpoint.setReceiver(out::add);

        endpoint.send(new byte[]{1, 2, 3}).get(1, TimeUnit.SECONDS);

        var ent = new Entity();
        ent.map("name").put("first", "Ada");
        ent.commit();
        hub.sendUpdate(ent.id(), ent.doc().exportSnapshot());
        hubLoop.barrier().get(5, TimeUnit.SECONDS);
        endpoint.send(MessageCodec.encode(new SyncMessage.Subscribe(ent.id(), null)));
        hubLoop.barrier().get(5, TimeUnit.SECONDS);

        assertEquals(1, out.size());
        var reply = (SyncMessage.HandleUpdate) MessageCodec.decode(out.get(0));
        assertEquals(ent.id(), reply.entityId());
    }

    @Test
    void cleanup_drops_every_subscription_of_the_connection() {
        var endpoint = new HubEndpoint(hub);
        var e1 = new Entity();
        var e2 = new Entity();
        endpoint.send(MessageCodec.encode(new SyncMessage.Subscribe(e1.id(), null)));
        endpoint.send(MessageCodec.encode(new SyncMessage.Subscribe(e2.id(), null)));
        assertEquals(2, endpoint.subscriptionCount());

        endpoint.send(MessageCodec.encode(new SyncMessage.Unsubscribe(e1.id())));
        assertEquals(0, hub.subscriberCount(e1.id()));

        endpoint.cleanup();
        assertEquals(0, endpoint.subscriptionCount());
        assertEquals(0, hub.subscriberCount(e2.id()));
    }
}
