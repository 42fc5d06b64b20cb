// file: sync/src/main/java/io/leafsync/peer/SaveLane.java
package io.leafsync.peer;

import io.leafsync.storage.StorageConfig;
import io.leafsync.storage.WriteThrottle;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Saves of one open entity to one writable storage, passed through that storage's throttle.
 * <p>
 * A throttle may drop a write in favour of a later one, so completion is tracked per lane:
 * whichever write finally runs completes every save requested before it.
 */
final class SaveLane {
    final StorageConfig storage;
    final WriteThrottle throttle;
    private final List<CompletableFuture<Void>> waiting = new ArrayList<>();

    SaveLane(StorageConfig storage) {
        this.storage = storage;
        this.throttle = storage.writeThrottle().newInstance();
    }

    /** Register a requested save; the returned future completes when a write covering it finishes. */
    synchronized CompletableFuture<Void> request() {
        var f = new CompletableFuture<Void>();
        waiting.add(f);
        return f;
    }

    synchronized List<CompletableFuture<Void>> drain() {
        var out = new ArrayList<>(waiting);
        waiting.clear();
        return out;
    }
}
