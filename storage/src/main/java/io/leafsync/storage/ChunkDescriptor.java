// file: src/main/java/io/leafsync/storage/ChunkDescriptor.java
package io.leafsync.storage;

import java.util.Objects;

/**
 * What the {@link ChunkIndex} remembers about a persisted chunk (everything but its bytes).
 *
 * @param kind       snapshot or incremental
 * @param hash       content hash, also the last key segment
 * @param byteLength size of the chunk in bytes
 */
public record ChunkDescriptor(ChunkKind kind, String hash, int byteLength) {
    public ChunkDescriptor {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(hash, "hash");
    }
}
