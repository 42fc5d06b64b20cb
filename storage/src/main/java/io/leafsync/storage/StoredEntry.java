// file: src/main/java/io/leafsync/storage/StoredEntry.java
package io.leafsync.storage;

import java.util.Optional;

/**
 * One result of {@link StorageBackend#loadRange(StorageKey)}. Backends may report a key
 * whose bytes could not be read as an entry with no data.
 */
public record StoredEntry(StorageKey key, byte[] data) {

    public Optional<byte[]> bytes() { return Optional.ofNullable(data); }
}
