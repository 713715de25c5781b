package me.golemcore.memory.knowledge;

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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulates usage-count increments in memory until a pending-count threshold
 * or a time interval is exceeded. The owner drains the buffer, writes the
 * counts durably, and restores the drained increments if the write fails.
 */
public class UsageCountBuffer {

    private final int threshold;
    private final Duration interval;
    private final Clock clock;

    private final Map<String, Integer> pending = new LinkedHashMap<>();
    private int pendingTotal;
    private Instant lastFlush;

    public UsageCountBuffer(int threshold, Duration interval, Clock clock) {
        this.threshold = Math.max(1, threshold);
        this.interval = interval;
        this.clock = clock;
        this.lastFlush = clock.instant();
    }

    public synchronized void increment(Collection<String> ids) {
        for (String id : ids) {
            pending.merge(id, 1, Integer::sum);
            pendingTotal++;
        }
    }

    public synchronized boolean shouldFlush() {
        if (pending.isEmpty()) {
            return false;
        }
        return pendingTotal >= threshold || !clock.instant().isBefore(lastFlush.plus(interval));
    }

    /**
     * Take every pending increment and reset the buffer.
     */
    public synchronized Map<String, Integer> drain() {
        Map<String, Integer> drained = new LinkedHashMap<>(pending);
        pending.clear();
        pendingTotal = 0;
        lastFlush = clock.instant();
        return drained;
    }

    /**
     * Merge increments back after a failed write.
     */
    public synchronized void restore(Map<String, Integer> drained) {
        drained.forEach((id, count) -> {
            pending.merge(id, count, Integer::sum);
            pendingTotal += count;
        });
    }

    public synchronized int pendingFor(String id) {
        return pending.getOrDefault(id, 0);
    }

    public synchronized int pendingTotal() {
        return pendingTotal;
    }

    public synchronized void discard(Collection<String> ids) {
        for (String id : ids) {
            Integer removed = pending.remove(id);
            if (removed != null) {
                pendingTotal -= removed;
            }
        }
    }

    public synchronized void clear() {
        pending.clear();
        pendingTotal = 0;
    }
}
