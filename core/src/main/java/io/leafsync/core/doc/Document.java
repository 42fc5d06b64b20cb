// file: src/main/java/io/leafsync/core/doc/Document.java
package io.leafsync.core.doc;

import io.leafsync.core.CausalOrder;
import io.leafsync.core.Subscription;
import io.leafsync.core.VersionVector;

import java.util.function.Consumer;

/**
 * CRDT state container owned by exactly one {@link io.leafsync.core.Entity}.
 * <p>
 * The sync and storage layers only rely on:
 *  - {@link #merge(byte[])}: commutative, associative and idempotent import of an update,
 *  - {@link #exportSnapshot()} / {@link #exportDelta(VersionVector)},
 *  - {@link #version()} and {@link #compareVersions(VersionVector, VersionVector)},
 *  - change notifications.
 * <p>
 * Implementations are not reentrant: calling a mutating method from inside one of the
 * document's own listener callbacks throws {@link IllegalStateException}. Listeners that
 * need to react with further document calls must hand the work to a task queue.
 */
public interface Document {

    /** Identifier this replica stamps on its own changes. */
    String peerId();

    /** Causal summary of everything applied so far. */
    VersionVector version();

    /**
     * Import a snapshot or delta produced by any replica.
     *
     * @throws DocumentFormatException if the bytes are malformed; nothing is applied in that case.
     */
    void merge(byte[] update);

    /** Everything this document knows, sufficient on its own to rebuild it. */
    byte[] exportSnapshot();

    /** The changes a replica at version {@code from} is missing. */
    byte[] exportDelta(VersionVector from);

    /** Seal local edits made since the last commit and notify listeners. No-op if there are none. */
    void commit();

    MapContainer map(String name);

    CounterContainer counter(String name);

    ListContainer list(String name);

    default Container container(ContainerKind kind, String name) {
        return switch (kind) {
            case MAP -> map(name);
            case COUNTER -> counter(name);
            case LIST -> list(name);
        };
    }

    /** Called after every local commit and every merge that changed the version. */
    Subscription subscribe(Consumer<DocumentEvent> listener);

    /** Called with the exact delta bytes of every local commit. */
    Subscription subscribeLocalUpdates(Consumer<byte[]> listener);

    /** Release all state; any later call throws {@link IllegalStateException}. */
    void free();

    boolean isFreed();

    static CausalOrder compareVersions(VersionVector a, VersionVector b) {
        return a.compare(b);
    }
}
