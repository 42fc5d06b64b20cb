// file: src/main/java/io/leafsync/storage/WriteThrottle.java
package io.leafsync.storage;

import io.leafsync.core.task.TaskQueue;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Future;

/**
 * Policy deciding when a requested write actually runs.
 * <p>
 * A throttle instance belongs to one (entity, storage) pair; callers create one per
 * pair via {@link #newInstance()}.
 */
public interface WriteThrottle {

    /** Run {@code write} now or later; a later submission may supersede an earlier one. */
    void submit(Runnable write);

    /** A fresh throttle with the same policy and no pending state. */
    WriteThrottle newInstance();

    /** Every write runs as soon as it is submitted. */
    static WriteThrottle immediate() {
        return Immediate.INSTANCE;
    }

    /**
     * Coalesce bursts: each submission cancels the pending one and waits {@code quiet}
     * before running on {@code queue}.
     */
    static WriteThrottle debounce(Duration quiet, TaskQueue queue) {
        return new Debounce(quiet, queue);
    }

    final class Immediate implements WriteThrottle {
        static final Immediate INSTANCE = new Immediate();

        private Immediate() {}

        @Override public void submit(Runnable write) { write.run(); }

        @Override public WriteThrottle newInstance() { return this; }
    }

    final class Debounce implements WriteThrottle {
        private final Duration quiet;
        private final TaskQueue queue;
        private Future<?> pending;

        Debounce(Duration quiet, TaskQueue queue) {
            if (quiet.isNegative()) throw new IllegalArgumentException("quiet must be >= 0");
            this.quiet = quiet;
            this.queue = Objects.requireNonNull(queue, "queue");
        }

        @Override
        public synchronized void submit(Runnable write) {
            if (pending != null) pending.cancel(false);
            pending = queue.schedule(write, quiet);
        }

        @Override
        public WriteThrottle newInstance() { return new Debounce(quiet, queue); }
    }
}
