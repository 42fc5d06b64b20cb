// file: src/main/java/io/leafsync/core/doc/Change.java
package io.leafsync.core.doc;

import java.util.Objects;

/**
 * One entry of a document's operation log.
 *
 * @param id        peer + counter identity
 * @param lamport   logical timestamp, used to order concurrent writes deterministically
 * @param container name of the container the op applies to
 * @param op        the edit itself
 */
public record Change(ChangeId id, long lamport, String container, Op op) {
    public Change {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(op, "op");
        if (lamport <= 0) throw new IllegalArgumentException("lamport must be > 0");
    }
}
