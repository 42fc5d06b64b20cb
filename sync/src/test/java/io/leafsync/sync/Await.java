package io.leafsync.sync;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/** Polling helper for asynchronous assertions. */
public final class Await {
    private Await() {}

    public static void until(BooleanSupplier condition, Duration timeout, String what) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) fail("timed out waiting for " + what);
            Thread.sleep(10);
        }
    }

    public static void until(BooleanSupplier condition, String what) throws InterruptedException {
        until(condition, Duration.ofSeconds(5), what);
    }
}
