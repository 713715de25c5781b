package me.golemcore.memory.task;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded work queue consumed by a fixed pool of daemon workers. Used for
 * background work that must not slow down the caller: quality assessment,
 * graph synchronisation, batched vector writes.
 *
 * <p>
 * What happens when the queue is full is chosen per call through
 * {@link Overflow}; there is no implicit fallback. Task failures are logged
 * and counted, never rethrown.
 */
@Component
@Slf4j
public class BackgroundTaskQueue {

    private static final long TERMINATION_TIMEOUT_SECONDS = 5;
    private static final long IDLE_POLL_MILLIS = 10;

    /**
     * Behaviour when the queue is full.
     */
    public enum Overflow {
        /** Fire and forget: the task is discarded. */
        DROP,
        /** Synchronous fallback: the task runs on the calling thread. */
        CALLER_RUNS
    }

    /**
     * What became of a submitted task.
     */
    public enum Outcome {
        QUEUED, RAN_INLINE, DROPPED
    }

    private final ThreadPoolExecutor executor;
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong inline = new AtomicLong();

    @Autowired
    public BackgroundTaskQueue(MemoryProperties properties) {
        this(properties.getTasks().getWorkers(), properties.getTasks().getQueueCapacity());
    }

    public BackgroundTaskQueue(int workers, int capacity) {
        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(Math.max(1, workers), Math.max(1, workers), 0L,
                TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(Math.max(1, capacity)), r -> {
                    Thread t = new Thread(r, "memory-task-" + threadIndex.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }, new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Submit a named task.
     *
     * @param name
     *            short label for logs
     */
    public Outcome submit(String name, Runnable task, Overflow overflow) {
        pending.incrementAndGet();
        try {
            executor.execute(() -> run(name, task));
            return Outcome.QUEUED;
        } catch (RejectedExecutionException e) {
            if (overflow == Overflow.CALLER_RUNS && !executor.isShutdown()) {
                inline.incrementAndGet();
                log.debug("[TaskQueue] Queue full, running {} on the caller thread", name);
                run(name, task);
                return Outcome.RAN_INLINE;
            }
            pending.decrementAndGet();
            dropped.incrementAndGet();
            log.warn("[TaskQueue] Queue full, dropping {}", name);
            return Outcome.DROPPED;
        }
    }

    /**
     * Wait until every accepted task has finished.
     *
     * @return false if {@code timeout} elapsed first
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pending.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(IDLE_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    public Stats stats() {
        return new Stats(pending.get(), completed.get(), failed.get(), dropped.get(), inline.get());
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private void run(String name, Runnable task) {
        try {
            task.run();
            completed.incrementAndGet();
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.warn("[TaskQueue] Task {} failed: {}", name, e.getMessage(), e);
        } finally {
            pending.decrementAndGet();
        }
    }

    public record Stats(int pending, long completed, long failed, long dropped, long ranInline) {
    }
}
