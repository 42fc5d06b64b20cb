// file: src/main/java/io/leafsync/core/task/EventLoop.java
package io.leafsync.core.task;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded {@link TaskQueue} backed by a scheduled executor.
 * <p>
 * Tasks run in submission order on one daemon thread. A task that throws is logged and
 * does not stop the loop.
 */
public final class EventLoop implements TaskQueue, Executor, AutoCloseable {
    private static final Logger log = Logger.getLogger(EventLoop.class.getName());

    private final String name;
    private final ScheduledExecutorService exec;
    private volatile Thread thread;

    public EventLoop(String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.exec = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            thread = t;
            return t;
        });
    }

    @Override
    public void defer(Runnable task) {
        exec.execute(guarded(task));
    }

    @Override
    public Future<?> schedule(Runnable task, Duration delay) {
        return exec.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void execute(Runnable command) {
        defer(command);
    }

    /** True when called from this loop's thread. */
    public boolean inLoop() {
        return Thread.currentThread() == thread;
    }

    /** Completes once every task deferred before this call has run. */
    public CompletableFuture<Void> barrier() {
        var done = new CompletableFuture<Void>();
        defer(() -> done.complete(null));
        return done;
    }

    public String name() { return name; }

    @Override
    public void close() {
        exec.shutdownNow();
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.log(Level.SEVERE, "task failed on loop " + name, e);
            }
        };
    }
}
