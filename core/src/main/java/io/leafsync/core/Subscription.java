// file: src/main/java/io/leafsync/core/Subscription.java
package io.leafsync.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle returned by every subscribe-style call. Unsubscribing more than once is a no-op.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();

    /** Wrap a cleanup action so it runs at most once. */
    static Subscription once(Runnable cleanup) {
        var done = new AtomicBoolean();
        return () -> {
            if (done.compareAndSet(false, true)) cleanup.run();
        };
    }

    /** A subscription with nothing to clean up. */
    static Subscription noop() {
        return () -> { };
    }
}
