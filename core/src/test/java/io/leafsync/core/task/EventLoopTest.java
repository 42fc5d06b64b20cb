// file: src/test/java/io/leafsync/core/task/EventLoopTest.java
package io.leafsync.core.task;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventLoopTest {

    @Test
    void tasks_run_in_order_on_the_loop_thread() throws Exception {
        try (var loop = new EventLoop("order")) {
            List<Integer> seen = new CopyOnWriteArrayList<>();
            List<Boolean> onLoop = new CopyOnWriteArrayList<>();
            for (int i = 0; i < 100; i++) {
                int n = i;
                loop.defer(() -> {
                    seen.add(n);
                    onLoop.add(loop.inLoop());
                });
            }
            loop.barrier().get(5, TimeUnit.SECONDS);

            assertEquals(100, seen.size());
            for (int i = 0; i < 100; i++) assertEquals(i, seen.get(i));
            assertFalse(onLoop.contains(false));
            assertFalse(loop.inLoop());
        }
    }

    @Test
    void a_failing_task_does_not_stop_the_loop() throws Exception {
        try (var loop = new EventLoop("failing")) {
            loop.defer(() -> { throw new IllegalStateException("boom"); });
            var ran = new CopyOnWriteArrayList<String>();
            loop.defer(() -> ran.add("after"));
            loop.barrier().get(5, TimeUnit.SECONDS);

            assertEquals(List.of("after"), ran);
        }
    }

    @Test
    void scheduled_task_can_be_cancelled() throws Exception {
        try (var loop = new EventLoop("scheduled")) {
            var ran = new CopyOnWriteArrayList<String>();
            var cancelled = loop.schedule(() -> ran.add("cancelled"), Duration.ofMillis(200));
            loop.schedule(() -> ran.add("kept"), Duration.ofMillis(50));
            cancelled.cancel(false);

            Thread.sleep(400);
            loop.barrier().get(5, TimeUnit.SECONDS);
            assertEquals(List.of("kept"), ran);
        }
    }
}
