package me.golemcore.memory.quality;

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

import me.golemcore.memory.domain.model.KnowledgeEntry;

import java.util.Map;

/**
 * Quality score of a knowledge entry in [0, 1]:
 * {@code 0.25 usage + 0.3 feedback + 0.3 content + 0.15 source}.
 */
public class KnowledgeScorer {

    private static final double USAGE_WEIGHT = 0.25;
    private static final double FEEDBACK_WEIGHT = 0.3;
    private static final double CONTENT_WEIGHT = 0.3;
    private static final double SOURCE_WEIGHT = 0.15;
    private static final double DEFAULT_SOURCE_SCORE = 0.5;
    private static final String PUNCTUATION = "。！？，、；：.!?,;:";

    private static final Map<String, Double> SOURCE_SCORES = Map.of(
            "manual", 0.9,
            "conversation:llm", 0.8,
            "conversation", 0.6,
            "file", 0.7,
            "mcp", 0.8,
            "import", 0.5);

    public double score(KnowledgeEntry entry) {
        return USAGE_WEIGHT * usageScore(entry)
                + FEEDBACK_WEIGHT * feedbackScore(entry)
                + CONTENT_WEIGHT * contentScore(entry)
                + SOURCE_WEIGHT * sourceScore(entry);
    }

    double usageScore(KnowledgeEntry entry) {
        int usage = entry.getUsageCount();
        if (usage <= 0) {
            return 0.0;
        }
        return Math.min(Math.log(usage + 1.0) / Math.log(100), 1.0);
    }

    double feedbackScore(KnowledgeEntry entry) {
        int total = entry.getPositiveFeedback() + entry.getNegativeFeedback();
        if (total == 0) {
            return 0.5;
        }
        return (double) entry.getPositiveFeedback() / total;
    }

    double contentScore(KnowledgeEntry entry) {
        String content = entry.getContent() != null ? entry.getContent() : "";
        int length = content.length();
        double lengthScore;
        if (length < 10) {
            lengthScore = 0.3;
        } else if (length < 50) {
            lengthScore = 0.6;
        } else if (length < 500) {
            lengthScore = 1.0;
        } else {
            lengthScore = 0.8;
        }
        double structureScore = content.chars().anyMatch(ch -> PUNCTUATION.indexOf(ch) >= 0) ? 1.0 : 0.5;
        double keywordScore = entry.getKeywords() != null && !entry.getKeywords().isEmpty() ? 1.0 : 0.5;
        return (lengthScore + structureScore + keywordScore) / 3.0;
    }

    double sourceScore(KnowledgeEntry entry) {
        if (entry.getSource() == null) {
            return SOURCE_SCORES.get("manual");
        }
        return SOURCE_SCORES.getOrDefault(entry.getSource(), DEFAULT_SOURCE_SCORE);
    }
}
