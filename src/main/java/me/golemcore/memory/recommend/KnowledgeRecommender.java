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
import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.infrastructure.config.MemoryProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Context-aware knowledge recommendation.
 *
 * <p>
 * Score = {@code 0.3 topic + 0.25 keyword + 0.15 recency + 0.15 quality +
 * 0.1 usage + 0.05 preference}. Preferences are learned per user from
 * feedback on categories and sources.
 */
@Slf4j
public class KnowledgeRecommender {

    private static final double NEUTRAL = 0.5;
    private static final double PREFERENCE_STEP = 0.1;
    private static final double RECENCY_DECAY_PER_DAY = 0.1;

    private final MemoryProperties.RecommendProperties config;
    private final Clock clock;
    private final Map<String, Preferences> preferences = new ConcurrentHashMap<>();
    private final Deque<HistoryRecord> history = new ArrayDeque<>();

    public KnowledgeRecommender(MemoryProperties.RecommendProperties config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public List<Recommendation> recommend(RecommendationContext context, List<KnowledgeEntry> entries, int k) {
        return recommend(context, entries, k, config.getMinScore());
    }

    public List<Recommendation> recommend(RecommendationContext context, List<KnowledgeEntry> entries, int k,
            double minScore) {
        if (entries == null || entries.isEmpty() || k <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        List<Recommendation> recommendations = entries.stream()
                .map(entry -> score(entry, context, now))
                .filter(recommendation -> recommendation.score() >= minScore)
                .sorted(Comparator.comparingDouble(Recommendation::score).reversed())
                .limit(k)
                .toList();
        record(context, recommendations, now);
        log.debug("[Recommender] {} recommendations for user {}", recommendations.size(), context.getUserId());
        return recommendations;
    }

    /**
     * Shift the user's category and source preference by 0.1 toward the
     * feedback, clamped to [0, 1].
     */
    public void updatePreference(String userId, KnowledgeEntry entry, boolean positive) {
        Preferences prefs = preferences.computeIfAbsent(userId, id -> new Preferences());
        double adjustment = positive ? PREFERENCE_STEP : -PREFERENCE_STEP;
        if (entry.getCategory() != null && !entry.getCategory().isEmpty()) {
            prefs.categories.merge(entry.getCategory(), NEUTRAL + adjustment,
                    (current, ignored) -> clamp(current + adjustment));
        }
        if (entry.getSource() != null && !entry.getSource().isEmpty()) {
            prefs.sources.merge(entry.getSource(), NEUTRAL + adjustment,
                    (current, ignored) -> clamp(current + adjustment));
        }
    }

    public double preferenceFor(String userId, KnowledgeEntry entry) {
        Preferences prefs = preferences.get(userId);
        if (prefs == null) {
            return NEUTRAL;
        }
        double category = prefs.categories.getOrDefault(nullToEmpty(entry.getCategory()), NEUTRAL);
        double source = prefs.sources.getOrDefault(nullToEmpty(entry.getSource()), NEUTRAL);
        return (category + source) / 2.0;
    }

    public List<HistoryRecord> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    private Recommendation score(KnowledgeEntry entry, RecommendationContext context, Instant now) {
        double score = 0.0;
        List<String> reasons = new ArrayList<>();

        double topic = topicRelevance(entry, context.getTopic(), orEmpty(context.getRecentTopics()));
        score += 0.3 * topic;
        if (topic > 0.7) {
            reasons.add("highly relevant to topic '" + context.getTopic() + "'");
        } else if (topic > 0.4) {
            reasons.add("relevant to topic '" + context.getTopic() + "'");
        }

        double keyword = keywordMatch(entry, orEmpty(context.getKeywords()), context.getQuery());
        score += 0.25 * keyword;
        if (keyword > 0.7) {
            reasons.add("matches several keywords");
        } else if (keyword > 0.4) {
            reasons.add("matches related keywords");
        }

        double recency = recency(entry, now);
        score += 0.15 * recency;
        if (recency > 0.8) {
            reasons.add("recently updated or used");
        }

        double quality = entry.getQualityScore() != null ? entry.getQualityScore() : NEUTRAL;
        score += 0.15 * quality;
        if (quality > 0.7) {
            reasons.add("high quality");
        }

        double usage = usage(entry.getUsageCount());
        score += 0.1 * usage;
        if (usage > 0.7) {
            reasons.add("frequently used");
        }

        double preference = preferenceFor(context.getUserId(), entry);
        score += 0.05 * preference;
        if (preference > 0.7) {
            reasons.add("matches your preferences");
        }
        return new Recommendation(entry, score, List.copyOf(reasons));
    }

    static double topicRelevance(KnowledgeEntry entry, String topic, List<String> recentTopics) {
        if (topic == null || topic.isEmpty()) {
            return 0.0;
        }
        String topicLower = topic.toLowerCase(Locale.ROOT);
        if (nullToEmpty(entry.getCategory()).toLowerCase(Locale.ROOT).equals(topicLower)) {
            return 1.0;
        }
        String title = nullToEmpty(entry.getTitle()).toLowerCase(Locale.ROOT);
        String content = nullToEmpty(entry.getContent()).toLowerCase(Locale.ROOT);
        double score = 0.0;
        if (title.contains(topicLower)) {
            score += 0.5;
        }
        if (content.contains(topicLower)) {
            score += 0.3;
        }
        for (String recent : recentTopics) {
            String recentLower = recent.toLowerCase(Locale.ROOT);
            if (title.contains(recentLower) || content.contains(recentLower)) {
                score += 0.2;
                break;
            }
        }
        return Math.min(1.0, score);
    }

    static double keywordMatch(KnowledgeEntry entry, List<String> keywords, String query) {
        boolean hasQuery = query != null && !query.isEmpty();
        if (keywords.isEmpty() && !hasQuery) {
            return 0.0;
        }
        String title = nullToEmpty(entry.getTitle()).toLowerCase(Locale.ROOT);
        String content = nullToEmpty(entry.getContent()).toLowerCase(Locale.ROOT);
        List<String> entryKeywords = entry.getKeywords() == null ? List.of()
                : entry.getKeywords().stream().map(kw -> kw.toLowerCase(Locale.ROOT)).toList();

        double matches = 0.0;
        int total = keywords.size();
        for (String keyword : keywords) {
            String lower = keyword.toLowerCase(Locale.ROOT);
            if (title.contains(lower) || content.contains(lower) || entryKeywords.contains(lower)) {
                matches += 1.0;
            }
        }
        if (hasQuery) {
            String queryLower = query.toLowerCase(Locale.ROOT);
            if (title.contains(queryLower)) {
                matches += 0.5;
            }
            if (content.contains(queryLower)) {
                matches += 0.3;
            }
            total++;
        }
        return total == 0 ? 0.0 : Math.min(1.0, matches / total);
    }

    /**
     * Linear decay of 0.1 per day since last use (or creation).
     */
    static double recency(KnowledgeEntry entry, Instant now) {
        Instant reference = entry.getLastUsed() != null ? entry.getLastUsed() : entry.getTimestamp();
        if (reference == null) {
            return NEUTRAL;
        }
        long days = Math.max(0, Duration.between(reference, now).toDays());
        return Math.max(0.0, 1.0 - days * RECENCY_DECAY_PER_DAY);
    }

    static double usage(int usageCount) {
        if (usageCount <= 0) {
            return 0.0;
        }
        return Math.min(1.0, Math.log(usageCount + 1.0) / Math.log(100));
    }

    private void record(RecommendationContext context, List<Recommendation> recommendations, Instant now) {
        HistoryRecord record = new HistoryRecord(context.getUserId(), now, recommendations.stream()
                .collect(Collectors.toMap(r -> r.entry().getId(), Recommendation::score, (a, b) -> a,
                        LinkedHashMap::new)));
        synchronized (history) {
            history.addLast(record);
            while (history.size() > config.getHistoryLimit()) {
                history.removeFirst();
            }
        }
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static List<String> orEmpty(List<String> values) {
        return values != null ? values : List.of();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    /**
     * One recommendation round: entry id to score, in rank order.
     */
    public record HistoryRecord(String userId, Instant timestamp, Map<String, Double> scores) {
    }

    private static final class Preferences {
        private final Map<String, Double> categories = new ConcurrentHashMap<>();
        private final Map<String, Double> sources = new ConcurrentHashMap<>();
    }
}
