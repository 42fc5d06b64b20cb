// file: sync/src/main/java/io/leafsync/sync/Subscriber.java
package io.leafsync.sync;

import io.leafsync.core.EntityId;

/** Receives updates for an entity from a {@link SyncInterface}. */
@FunctionalInterface
public interface Subscriber {
    void handleUpdate(EntityId id, byte[] update);
}
