// file: sync/src/main/java/io/leafsync/sync/SyncInterface.java
package io.leafsync.sync;

import io.leafsync.core.EntityId;
import io.leafsync.core.Subscription;

/**
 * Transport-neutral contract between a peer and whatever it syncs with
 * (a hub in the same process, or a hub behind a network connection).
 */
public interface SyncInterface {

    /**
     * Ask for updates to {@code id}.
     * <p>
     * The remote side answers with the changes it has that a replica at {@code localVersion}
     * is missing, then keeps forwarding updates until the returned subscription is cancelled.
     *
     * @param localVersion encoded {@link io.leafsync.core.VersionVector} of the caller's
     *                     replica, or null if the caller has nothing.
     */
    Subscription subscribe(EntityId id, byte[] localVersion, Subscriber subscriber);

    /** Publish an update (snapshot or delta) for {@code id}. */
    void sendUpdate(EntityId id, byte[] update);
}
