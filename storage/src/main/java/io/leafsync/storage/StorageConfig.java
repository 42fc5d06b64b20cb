// file: src/main/java/io/leafsync/storage/StorageConfig.java
package io.leafsync.storage;

import java.util.Objects;

/**
 * One storage a peer uses, and how.
 *
 * @param manager       the storage
 * @param read          load entities from it when opening them
 * @param write         save entities to it when they change
 * @param writeThrottle when saves run
 */
public record StorageConfig(StorageManager manager, boolean read, boolean write, WriteThrottle writeThrottle) {

    public StorageConfig {
        Objects.requireNonNull(manager, "manager");
        Objects.requireNonNull(writeThrottle, "writeThrottle");
    }

    /** Read and write, saving immediately. */
    public static StorageConfig of(StorageManager manager) {
        return new StorageConfig(manager, true, true, WriteThrottle.immediate());
    }

    public static StorageConfig of(StorageBackend backend) {
        return of(new StorageManager(backend));
    }

    public StorageConfig withThrottle(WriteThrottle throttle) {
        return new StorageConfig(manager, read, write, throttle);
    }

    public StorageConfig readOnly() {
        return new StorageConfig(manager, true, false, writeThrottle);
    }

    public StorageConfig writeOnly() {
        return new StorageConfig(manager, false, true, writeThrottle);
    }
}
