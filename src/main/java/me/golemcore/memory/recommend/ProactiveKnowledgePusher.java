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
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes knowledge without an explicit request. Triggers: the topic moves
 * away from the recent ones, the user asks a question, or the user follows up
 * (with more than a filler reply) on knowledge just used. A per-user cooldown
 * limits how often this happens, and an entry is never pushed twice to the
 * same user.
 */
@Slf4j
public class ProactiveKnowledgePusher {

    private static final double DEFAULT_QUALITY = 0.5;
    private static final List<String> QUESTION_WORDS = List.of("什么", "怎么", "为什么", "哪里", "谁", "如何", "吗", "？",
            "?");
    private static final Set<String> FILLER_MESSAGES = Set.of("好的", "好", "嗯", "嗯嗯", "哦", "谢谢", "ok", "okay",
            "thanks", "thx", "yes", "no");

    private final MemoryProperties.PushProperties config;
    private final int historyLimit;
    private final Clock clock;
    private final Map<String, Instant> lastPush = new ConcurrentHashMap<>();
    private final Deque<PushRecord> history = new ArrayDeque<>();

    public ProactiveKnowledgePusher(MemoryProperties.PushProperties config, int historyLimit, Clock clock) {
        this.config = config;
        this.historyLimit = historyLimit;
        this.clock = clock;
    }

    public boolean shouldPush(String userId, RecommendationContext context) {
        if (!cooldownElapsed(userId)) {
            return false;
        }
        return isTopicChange(context) || isKnowledgeGap(context) || isFollowUp(context);
    }

    public List<PushedKnowledge> push(String userId, RecommendationContext context, List<KnowledgeEntry> entries,
            int k) {
        if (k <= 0 || !shouldPush(userId, context)) {
            return List.of();
        }
        Set<String> alreadyPushed = pushedIds(userId);
        List<PushedKnowledge> pushed = entries.stream()
                .filter(entry -> !alreadyPushed.contains(entry.getId()))
                .filter(entry -> quality(entry) >= config.getMinQuality())
                .map(entry -> new PushedKnowledge(entry, relevance(entry, context)))
                .filter(candidate -> candidate.relevance() >= config.getMinRelevance())
                .sorted(Comparator.comparingDouble(PushedKnowledge::relevance).reversed())
                .limit(k)
                .toList();
        if (pushed.isEmpty()) {
            return List.of();
        }
        Instant now = clock.instant();
        synchronized (history) {
            history.addLast(new PushRecord(userId, now, pushed.stream().map(p -> p.entry().getId()).toList()));
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
        }
        lastPush.put(userId, now);
        log.info("[Pusher] Pushed {} entries to {}", pushed.size(), userId);
        return pushed;
    }

    /**
     * {@code 0.5} for a category equal to the topic, {@code 0.1} per shared
     * keyword up to {@code 0.3}, plus {@code 0.2 * quality}.
     */
    static double relevance(KnowledgeEntry entry, RecommendationContext context) {
        double score = 0.0;
        String topic = context.getTopic();
        if (topic != null && !topic.isEmpty() && entry.getCategory() != null
                && entry.getCategory().toLowerCase(Locale.ROOT).equals(topic.toLowerCase(Locale.ROOT))) {
            score += 0.5;
        }
        List<String> keywords = context.getKeywords();
        if (keywords != null && !keywords.isEmpty() && entry.getKeywords() != null
                && !entry.getKeywords().isEmpty()) {
            Set<String> common = lowerCase(keywords);
            common.retainAll(lowerCase(entry.getKeywords()));
            score += Math.min(0.3, common.size() * 0.1);
        }
        return score + quality(entry) * 0.2;
    }

    private boolean cooldownElapsed(String userId) {
        Instant last = lastPush.get(userId);
        return last == null
                || Duration.between(last, clock.instant()).getSeconds() >= config.getCooldownSeconds();
    }

    private static boolean isTopicChange(RecommendationContext context) {
        String topic = context.getTopic();
        List<String> recent = context.getRecentTopics();
        return topic != null && !topic.isEmpty() && recent != null && !recent.isEmpty() && !recent.contains(topic);
    }

    private static boolean isKnowledgeGap(RecommendationContext context) {
        if (context.getUserMessage() == null) {
            return false;
        }
        String message = context.getUserMessage().toLowerCase(Locale.ROOT);
        return QUESTION_WORDS.stream().anyMatch(message::contains);
    }

    private static boolean isFollowUp(RecommendationContext context) {
        if (context.getLastUsedKnowledgeId() == null || context.getLastUsedKnowledgeId().isEmpty()) {
            return false;
        }
        String message = context.getUserMessage();
        return message != null && !message.isBlank()
                && !FILLER_MESSAGES.contains(message.strip().toLowerCase(Locale.ROOT).replaceAll("[!！.。~]+$", ""));
    }

    private Set<String> pushedIds(String userId) {
        Set<String> ids = new HashSet<>();
        synchronized (history) {
            history.stream().filter(record -> record.userId().equals(userId))
                    .forEach(record -> ids.addAll(record.entryIds()));
        }
        return ids;
    }

    private static Set<String> lowerCase(Collection<String> values) {
        Set<String> lowered = new HashSet<>();
        values.forEach(value -> lowered.add(value.toLowerCase(Locale.ROOT)));
        return lowered;
    }

    private static double quality(KnowledgeEntry entry) {
        return entry.getQualityScore() != null ? entry.getQualityScore() : DEFAULT_QUALITY;
    }

    public record PushRecord(String userId, Instant timestamp, List<String> entryIds) {
    }
}
