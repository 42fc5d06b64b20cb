// file: src/main/java/io/leafsync/core/doc/ChangeId.java
package io.leafsync.core.doc;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of one change: the peer that made it and its position in that peer's history.
 * Counters start at 1 and are contiguous per peer.
 */
public record ChangeId(String peerId, long counter) implements Comparable<ChangeId> {
    private static final Comparator<ChangeId> ORDER =
            Comparator.comparing(ChangeId::peerId).thenComparingLong(ChangeId::counter);

    public ChangeId {
        Objects.requireNonNull(peerId, "peerId");
        if (counter <= 0) throw new IllegalArgumentException("counter must be > 0");
    }

    @Override
    public int compareTo(ChangeId o) { return ORDER.compare(this, o); }
}
