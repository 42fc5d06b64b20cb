// file: src/main/java/io/leafsync/storage/ChunkIndex.java
package io.leafsync.storage;

import io.leafsync.core.EntityId;
import io.leafsync.core.VersionVector;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory record of which chunks a {@link StorageManager} believes exist per entity,
 * and the document version they were produced from.
 * <p>
 * Used by save to skip redundant writes and to know which chunks to garbage-collect.
 */
public final class ChunkIndex {

    /** Chunks last loaded or written for an entity, plus the version at that time. */
    public record Entry(List<ChunkDescriptor> chunks, VersionVector version) {
        public Entry {
            chunks = List.copyOf(chunks);
        }
    }

    private final Map<EntityId, Entry> entries = new ConcurrentHashMap<>();

    public Optional<Entry> get(EntityId id) {
        return Optional.ofNullable(entries.get(id));
    }

    public void put(EntityId id, Entry entry) {
        entries.put(id, entry);
    }

    public void remove(EntityId id) {
        entries.remove(id);
    }
}
