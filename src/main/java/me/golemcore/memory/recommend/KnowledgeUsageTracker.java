package me.golemcore.memory.recommend;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.persistence.JsonDocumentStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks how knowledge entries are used (search hits, recommendations,
 * pushes) and how users rate them. Changes are written after
 * {@code flushEvery} events or on {@link #flush()}.
 */
@Slf4j
public class KnowledgeUsageTracker {

    private static final int MAX_EVENTS_PER_ENTRY = 100;

    private final JsonDocumentStore<UsageStatistics> store;
    private final Clock clock;
    private final int flushEvery;
    private final ReentrantLock lock = new ReentrantLock();

    private UsageStatistics stats = new UsageStatistics();
    private int unsaved;

    public KnowledgeUsageTracker(JsonDocumentStore<UsageStatistics> store, int flushEvery, Clock clock) {
        this.store = store;
        this.flushEvery = Math.max(1, flushEvery);
        this.clock = clock;
    }

    public void load() {
        lock.lock();
        try {
            stats = store.load();
            unsaved = 0;
        } finally {
            lock.unlock();
        }
    }

    public void recordUsage(String entryId, RecommendationContext context, UsageType type) {
        lock.lock();
        try {
            Instant now = clock.instant();
            UsageStatistics.EntryUsage usage = stats.getKnowledgeStats()
                    .computeIfAbsent(entryId, id -> new UsageStatistics.EntryUsage());
            usage.setUsageCount(usage.getUsageCount() + 1);
            usage.setLastUsed(now);
            List<String> keywords = context != null && context.getKeywords() != null
                    ? new ArrayList<>(context.getKeywords())
                    : new ArrayList<>();
            usage.getUsageHistory().add(new UsageStatistics.UsageEvent(now, type,
                    context != null ? context.getTopic() : null, keywords));
            int overflow = usage.getUsageHistory().size() - MAX_EVENTS_PER_ENTRY;
            if (overflow > 0) {
                usage.getUsageHistory().subList(0, overflow).clear();
            }

            UsageStatistics.GlobalUsage global = stats.getGlobalStats();
            global.setTotalUsage(global.getTotalUsage() + 1);
            if (type == UsageType.RECOMMENDATION) {
                global.setTotalRecommendations(global.getTotalRecommendations() + 1);
            } else if (type == UsageType.PUSH) {
                global.setTotalPushes(global.getTotalPushes() + 1);
            }
            markChanged();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Feedback for an entry that has never been used is ignored.
     */
    public void recordFeedback(String entryId, boolean positive) {
        lock.lock();
        try {
            UsageStatistics.EntryUsage usage = stats.getKnowledgeStats().get(entryId);
            if (usage == null) {
                return;
            }
            usage.setFeedbackCount(usage.getFeedbackCount() + 1);
            if (positive) {
                usage.setPositiveFeedback(usage.getPositiveFeedback() + 1);
            }
            markChanged();
        } finally {
            lock.unlock();
        }
    }

    public Optional<UsageStatistics.EntryUsage> statsFor(String entryId) {
        lock.lock();
        try {
            return Optional.ofNullable(stats.getKnowledgeStats().get(entryId));
        } finally {
            lock.unlock();
        }
    }

    public List<TopUsage> topUsed(int k) {
        lock.lock();
        try {
            return stats.getKnowledgeStats().entrySet().stream()
                    .map(e -> new TopUsage(e.getKey(), e.getValue().getUsageCount(), e.getValue().getLastUsed()))
                    .sorted(Comparator.comparingInt(TopUsage::usageCount).reversed())
                    .limit(Math.max(0, k))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ids among {@code allIds} never used, or not used within {@code days}.
     */
    public List<String> unused(Collection<String> allIds, int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        lock.lock();
        try {
            return allIds.stream()
                    .filter(id -> {
                        UsageStatistics.EntryUsage usage = stats.getKnowledgeStats().get(id);
                        return usage == null || usage.getLastUsed() == null || usage.getLastUsed().isBefore(cutoff);
                    })
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public UsageStatistics.GlobalUsage globalStats() {
        lock.lock();
        try {
            UsageStatistics.GlobalUsage copy = new UsageStatistics.GlobalUsage();
            copy.setTotalUsage(stats.getGlobalStats().getTotalUsage());
            copy.setTotalRecommendations(stats.getGlobalStats().getTotalRecommendations());
            copy.setTotalPushes(stats.getGlobalStats().getTotalPushes());
            return copy;
        } finally {
            lock.unlock();
        }
    }

    public String report() {
        UsageStatistics.GlobalUsage global = globalStats();
        int tracked;
        lock.lock();
        try {
            tracked = stats.getKnowledgeStats().size();
        } finally {
            lock.unlock();
        }
        StringBuilder report = new StringBuilder("""
                Knowledge usage report
                ======================

                Totals:
                - usages: %d
                - recommendations: %d
                - pushes: %d
                - entries with usage: %d

                Most used (top 5):
                """.formatted(global.getTotalUsage(), global.getTotalRecommendations(), global.getTotalPushes(),
                tracked));
        List<TopUsage> top = topUsed(5);
        for (int i = 0; i < top.size(); i++) {
            report.append(i + 1).append(". ").append(top.get(i).entryId()).append(" (")
                    .append(top.get(i).usageCount()).append(" uses)\n");
        }
        return report.toString();
    }

    /**
     * Write pending changes.
     */
    public void flush() {
        lock.lock();
        try {
            if (unsaved == 0) {
                return;
            }
            store.save(stats);
            unsaved = 0;
        } catch (IllegalStateException e) {
            log.warn("[UsageTracker] Failed to save usage statistics, will retry: {}", e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private void markChanged() {
        unsaved++;
        if (unsaved >= flushEvery) {
            flush();
        }
    }

    public record TopUsage(String entryId, int usageCount, Instant lastUsed) {
    }
}
