package me.golemcore.memory.task;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackgroundTaskQueueTest {

    private final BackgroundTaskQueue queue = new BackgroundTaskQueue(1, 1);
    private final CountDownLatch release = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        release.countDown();
        queue.shutdown();
    }

    @Test
    void shouldRunSubmittedTask() {
        CountDownLatch done = new CountDownLatch(1);

        assertEquals(BackgroundTaskQueue.Outcome.QUEUED,
                queue.submit("test", done::countDown, BackgroundTaskQueue.Overflow.DROP));

        assertTrue(queue.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(0, done.getCount());
        assertEquals(1, queue.stats().completed());
    }

    @Test
    void shouldDropWhenFull() {
        fill();

        assertEquals(BackgroundTaskQueue.Outcome.DROPPED,
                queue.submit("extra", () -> { }, BackgroundTaskQueue.Overflow.DROP));
        assertEquals(1, queue.stats().dropped());
    }

    @Test
    void shouldRunOnCallerWhenFullAndRequested() {
        fill();
        AtomicReference<Thread> ranOn = new AtomicReference<>();

        assertEquals(BackgroundTaskQueue.Outcome.RAN_INLINE,
                queue.submit("sync", () -> ranOn.set(Thread.currentThread()),
                        BackgroundTaskQueue.Overflow.CALLER_RUNS));
        assertEquals(Thread.currentThread(), ranOn.get());
        assertEquals(1, queue.stats().ranInline());
    }

    @Test
    void shouldCountFailuresWithoutRethrowing() {
        queue.submit("boom", () -> {
            throw new IllegalStateException("boom");
        }, BackgroundTaskQueue.Overflow.DROP);

        assertTrue(queue.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(1, queue.stats().failed());
    }

    private void fill() {
        CountDownLatch started = new CountDownLatch(1);
        queue.submit("blocker", () -> {
            started.countDown();
            await();
        }, BackgroundTaskQueue.Overflow.DROP);
        await(started);
        queue.submit("queued", () -> { }, BackgroundTaskQueue.Overflow.DROP);
    }

    private void await() {
        await(release);
    }

    private static void await(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
