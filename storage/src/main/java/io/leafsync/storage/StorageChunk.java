// file: src/main/java/io/leafsync/storage/StorageChunk.java
package io.leafsync.storage;

/** A chunk as read from storage: descriptor plus bytes. */
public record StorageChunk(ChunkDescriptor descriptor, byte[] data) {

    public ChunkKind kind() { return descriptor.kind(); }
}
