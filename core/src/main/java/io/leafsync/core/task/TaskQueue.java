// file: src/main/java/io/leafsync/core/task/TaskQueue.java
package io.leafsync.core.task;

import java.time.Duration;
import java.util.concurrent.Future;

/**
 * Cooperative scheduling seam.
 * <p>
 * Everything a peer does to its own state runs as a task on its queue, one at a time.
 * Work that must not run inline (for example reacting to a document callback) is
 * {@link #defer deferred} to a later turn instead.
 */
public interface TaskQueue {

    /** Run {@code task} on a later turn of this queue. */
    void defer(Runnable task);

    /** Run {@code task} on this queue once {@code delay} has elapsed. */
    Future<?> schedule(Runnable task, Duration delay);
}
