// file: sync/src/main/java/io/leafsync/sync/SyncState.java
package io.leafsync.sync;

/** Lifecycle of one entity inside a {@link SyncEngine}. */
public enum SyncState {
    /** Known to the engine, subscription not sent yet. */
    IDLE,
    /** Subscribed, waiting for the first update from the remote side. */
    SUBSCRIBING,
    /** At least one remote update has been applied. */
    ACTIVE,
    /** Unsynced; nothing is sent or applied any more. */
    STOPPED
}
