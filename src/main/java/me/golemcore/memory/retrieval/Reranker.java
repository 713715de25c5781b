package me.golemcore.memory.retrieval;

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

import me.golemcore.memory.domain.model.RerankContext;
import me.golemcore.memory.domain.model.RetrievalCandidate;
import me.golemcore.memory.domain.model.ScoreBreakdown;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.text.TextSimilarity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Second-pass scoring of retrieval candidates.
 *
 * <pre>
 * final = 0.3 base + 0.15 recency + 0.2 importance + 0.15 usage + 0.2 context
 * </pre>
 *
 * Recency decays as {@code exp(-ageDays / 365)}; usage saturates at 99 uses
 * ({@code min(log(n + 1) / log(100), 1)}); context is 1.0 on an exact
 * category match, otherwise the keyword Jaccard overlap, or a neutral 0.5 when
 * either keyword set is empty.
 *
 * <p>
 * Pure: inputs are never modified, the result is a new ranked list. Ties are
 * broken by the base score.
 */
public class Reranker {

    private static final double NEUTRAL = 0.5;
    private static final double SECONDS_PER_DAY = 86400.0;

    private final MemoryProperties.RerankProperties weights;
    private final Clock clock;

    public Reranker(MemoryProperties.RerankProperties weights, Clock clock) {
        this.weights = weights;
        this.clock = clock;
    }

    public List<RetrievalCandidate> rerank(List<RetrievalCandidate> candidates, String query,
            RerankContext context) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        RerankContext effective = context != null ? context : RerankContext.empty();
        Instant now = clock.instant();

        return candidates.stream()
                .map(candidate -> score(candidate, effective, now))
                .sorted(Comparator.comparingDouble(RetrievalCandidate::getFinalScore).reversed()
                        .thenComparing(Comparator.comparingDouble(RetrievalCandidate::getScore).reversed()))
                .toList();
    }

    private RetrievalCandidate score(RetrievalCandidate candidate, RerankContext context, Instant now) {
        ScoreBreakdown breakdown = new ScoreBreakdown(
                candidate.getScore(),
                recency(candidate.getTimestamp(), now),
                candidate.getImportance() != null ? clamp(candidate.getImportance()) : NEUTRAL,
                usage(candidate.getUsageCount()),
                contextMatch(candidate, context));

        double finalScore = weights.getBaseWeight() * breakdown.base()
                + weights.getRecencyWeight() * breakdown.recency()
                + weights.getImportanceWeight() * breakdown.importance()
                + weights.getUsageWeight() * breakdown.usage()
                + weights.getContextWeight() * breakdown.contextMatch();

        return candidate.toBuilder()
                .finalScore(finalScore)
                .breakdown(breakdown)
                .build();
    }

    double recency(Instant timestamp, Instant now) {
        if (timestamp == null) {
            return NEUTRAL;
        }
        double ageDays = Math.max(0.0, Duration.between(timestamp, now).getSeconds() / SECONDS_PER_DAY);
        return Math.exp(-ageDays / weights.getRecencyDecayDays());
    }

    static double usage(int usageCount) {
        if (usageCount <= 0) {
            return 0.0;
        }
        return Math.min(Math.log(usageCount + 1.0) / Math.log(100.0), 1.0);
    }

    static double contextMatch(RetrievalCandidate candidate, RerankContext context) {
        if (context.category() != null && context.category().equals(candidate.getCategory())) {
            return 1.0;
        }
        Set<String> contextKeywords = context.keywordsOrEmpty();
        Set<String> entryKeywords = candidate.getKeywords() != null ? candidate.getKeywords() : Set.of();
        if (contextKeywords.isEmpty() || entryKeywords.isEmpty()) {
            return NEUTRAL;
        }
        return TextSimilarity.jaccard(contextKeywords, entryKeywords);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
