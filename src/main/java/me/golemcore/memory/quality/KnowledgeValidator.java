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

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural, content, consistency and freshness checks for knowledge
 * entries.
 */
public class KnowledgeValidator {

    public static final String MISSING_TITLE = "missing title";
    public static final String MISSING_CONTENT = "missing content";
    public static final String CONTENT_TOO_SHORT = "content too short";
    public static final String CONTENT_TOO_LONG = "content too long";
    public static final String LOW_CONSISTENCY = "title and content are weakly related";
    public static final String OUTDATED = "knowledge may be outdated";

    private static final int MIN_CONTENT_LENGTH = 10;
    private static final int MAX_CONTENT_LENGTH = 2000;
    private static final double MIN_TITLE_OVERLAP = 0.3;
    private static final long OUTDATED_AFTER_DAYS = 365;
    private static final Set<String> STOP_WORDS = Set.of("的", "了", "是", "在", "和", "与", "或", "a", "an", "the",
            "is", "are", "was", "were");

    private final KnowledgeScorer scorer;
    private final Clock clock;

    public KnowledgeValidator(KnowledgeScorer scorer, Clock clock) {
        this.scorer = scorer;
        this.clock = clock;
    }

    public ValidationResult validate(KnowledgeEntry entry) {
        boolean valid = true;
        List<String> issues = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();

        if (isBlank(entry.getTitle())) {
            valid = false;
            issues.add(MISSING_TITLE);
        }
        if (isBlank(entry.getContent())) {
            valid = false;
            issues.add(MISSING_CONTENT);
        }

        String content = entry.getContent() != null ? entry.getContent() : "";
        if (content.length() < MIN_CONTENT_LENGTH) {
            issues.add(CONTENT_TOO_SHORT);
            suggestions.add("add more detail");
        }
        if (content.length() > MAX_CONTENT_LENGTH) {
            issues.add(CONTENT_TOO_LONG);
            suggestions.add("split into several entries");
        }
        if (!isConsistent(entry.getTitle(), content)) {
            issues.add(LOW_CONSISTENCY);
        }
        if (isOutdated(entry)) {
            issues.add(OUTDATED);
            suggestions.add("review or refresh this entry");
        }
        return new ValidationResult(valid, List.copyOf(issues), List.copyOf(suggestions), scorer.score(entry));
    }

    /**
     * At least 30% of the title's words must appear in the content.
     */
    boolean isConsistent(String title, String content) {
        if (isBlank(title) || isBlank(content)) {
            return true;
        }
        Set<String> titleWords = words(title);
        if (titleWords.isEmpty()) {
            return true;
        }
        Set<String> common = new HashSet<>(titleWords);
        common.retainAll(words(content));
        return common.size() >= titleWords.size() * MIN_TITLE_OVERLAP;
    }

    boolean isOutdated(KnowledgeEntry entry) {
        if (entry.getTimestamp() == null) {
            return false;
        }
        return Duration.between(entry.getTimestamp(), clock.instant()).toDays() > OUTDATED_AFTER_DAYS;
    }

    private static Set<String> words(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(word -> !word.isEmpty() && !STOP_WORDS.contains(word))
                .collect(Collectors.toSet());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
