// file: src/main/java/io/leafsync/storage/StorageBackend.java
package io.leafsync.storage;

import java.util.List;
import java.util.Optional;

/**
 * Backing key-value storage used by {@link StorageManager}.
 * <p>
 * Semantics:
 *  - save() must be durable before returning.
 *  - loadRange() returns every record whose key starts with the prefix, in key order.
 *  - remove() of a missing key is not an error.
 * <p>
 * Failures are reported as {@link StorageException}.
 */
public interface StorageBackend {

    /** Load the bytes at a given key. */
    Optional<byte[]> load(StorageKey key);

    /** Save the given bytes at the key, replacing any previous value. */
    void save(StorageKey key, byte[] data);

    /** Remove the record at the key. */
    void remove(StorageKey key);

    /** Load all records whose key starts with the prefix. */
    List<StoredEntry> loadRange(StorageKey prefix);

    /** Remove all records whose key starts with the prefix. */
    void removeRange(StorageKey prefix);
}
