// file: src/main/java/io/leafsync/storage/ChunkKind.java
package io.leafsync.storage;

/** How a persisted chunk relates to the document it belongs to. */
public enum ChunkKind {
    /** Sufficient on its own to rebuild the document state at save time. */
    SNAPSHOT("snapshot"),
    /** Legacy partial update; only meaningful on top of a snapshot. */
    INCREMENTAL("incremental");

    private final String keySegment;

    ChunkKind(String keySegment) {
        this.keySegment = keySegment;
    }

    /** The segment used for this kind in storage keys. */
    public String keySegment() { return keySegment; }

    /** Anything that is not a snapshot is treated as incremental. */
    public static ChunkKind fromKeySegment(String segment) {
        return SNAPSHOT.keySegment.equals(segment) ? SNAPSHOT : INCREMENTAL;
    }
}
