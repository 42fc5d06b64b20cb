// file: sync/src/main/java/io/leafsync/peer/OpenOptions.java
package io.leafsync.peer;

import java.time.Duration;
import java.util.Optional;

/**
 * Options for {@link LocalPeer#open}.
 *
 * @param createAfterTimeout if the entity is not in local storage, how long to wait for a
 *                           remote copy before handing out an empty entity. Null means wait
 *                           until a remote copy arrives.
 */
public record OpenOptions(Duration createAfterTimeout) {

    private static final OpenOptions DEFAULT = new OpenOptions(null);

    public OpenOptions {
        if (createAfterTimeout != null && createAfterTimeout.isNegative()) {
            throw new IllegalArgumentException("createAfterTimeout must be >= 0");
        }
    }

    /** Wait for a remote copy however long it takes. */
    public static OpenOptions defaults() { return DEFAULT; }

    public static OpenOptions createAfter(Duration timeout) {
        return new OpenOptions(timeout);
    }

    public Optional<Duration> timeout() {
        return Optional.ofNullable(createAfterTimeout);
    }
}
