// file: sync/src/main/java/io/leafsync/peer/PeerConfig.java
package io.leafsync.peer;

import io.leafsync.storage.StorageBackend;
import io.leafsync.storage.StorageConfig;
import io.leafsync.sync.SyncInterface;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of a {@link LocalPeer}.
 * <p>
 * Defaults (via {@link #builder()}):
 *   - no storages: entities live only in memory,
 *   - no syncers: entities are local only,
 *   - no idle eviction: an entity is closed as soon as its last handle is released.
 *
 * @param storages     where entities are loaded from and saved to
 * @param syncers      what entities are kept in sync with
 * @param idleEviction how long an entity without handles stays open; null closes it at once
 */
public record PeerConfig(List<StorageConfig> storages, List<SyncInterface> syncers, Duration idleEviction) {

    public PeerConfig {
        storages = List.copyOf(storages);
        syncers = List.copyOf(syncers);
        if (idleEviction != null && idleEviction.isNegative()) {
            throw new IllegalArgumentException("idleEviction must be >= 0");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<StorageConfig> storages = new ArrayList<>();
        private final List<SyncInterface> syncers = new ArrayList<>();
        private Duration idleEviction;

        private Builder() {}

        public Builder storage(StorageConfig storage) {
            storages.add(Objects.requireNonNull(storage, "storage"));
            return this;
        }

        /** Read/write storage with immediate saves. */
        public Builder storage(StorageBackend backend) {
            return storage(StorageConfig.of(backend));
        }

        public Builder sync(SyncInterface syncer) {
            syncers.add(Objects.requireNonNull(syncer, "syncer"));
            return this;
        }

        public Builder idleEviction(Duration idleEviction) {
            this.idleEviction = idleEviction;
            return this;
        }

        public PeerConfig build() {
            return new PeerConfig(storages, syncers, idleEviction);
        }
    }
}
