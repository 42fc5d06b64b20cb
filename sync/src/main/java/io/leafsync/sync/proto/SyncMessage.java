// file: sync/src/main/java/io/leafsync/sync/proto/SyncMessage.java
package io.leafsync.sync.proto;

import io.leafsync.core.EntityId;

import java.util.Objects;

/**
 * Messages exchanged between a client and a hub over a {@link BinaryChannel}.
 * <p>
 * Client to hub: {@link Subscribe}, {@link Unsubscribe}, {@link SendUpdate}.
 * Hub to client: {@link HandleUpdate}.
 */
public sealed interface SyncMessage {

    EntityId entityId();

    /** Wire tag, see {@link MessageCodec}. */
    byte tag();

    /** @param version encoded version vector of the client's replica, null if it has nothing. */
    record Subscribe(EntityId entityId, byte[] version) implements SyncMessage {
        public Subscribe { Objects.requireNonNull(entityId, "entityId"); }
        @Override public byte tag() { return 1; }
    }

    record Unsubscribe(EntityId entityId) implements SyncMessage {
        public Unsubscribe { Objects.requireNonNull(entityId, "entityId"); }
        @Override public byte tag() { return 2; }
    }

    record SendUpdate(EntityId entityId, byte[] update) implements SyncMessage {
        public SendUpdate {
            Objects.requireNonNull(entityId, "entityId");
            Objects.requireNonNull(update, "update");
        }
        @Override public byte tag() { return 3; }
    }

    record HandleUpdate(EntityId entityId, byte[] update) implements SyncMessage {
        public HandleUpdate {
            Objects.requireNonNull(entityId, "entityId");
            Objects.requireNonNull(update, "update");
        }
        @Override public byte tag() { return 4; }
    }
}
