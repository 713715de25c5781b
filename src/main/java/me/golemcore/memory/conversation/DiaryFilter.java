package me.golemcore.memory.conversation;

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

import me.golemcore.memory.domain.model.DiaryEntry;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.text.ContentHash;
import me.golemcore.memory.text.TextSimilarity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether an interaction deserves a diary entry.
 *
 * <p>
 * Hard gates run first, in this order: minimum content length, near-duplicate
 * check against the most recent {@code dedupWindow} entries, daily entry cap,
 * and minimum interval since the previous entry (waived for entries at or
 * above the importance threshold). A candidate that passes them is saved when
 * any of these holds:
 * <ul>
 * <li>importance reaches the threshold</li>
 * <li>happy or excited, with high importance, long content or a person,
 * place or event, while the daily happy cap is not reached</li>
 * <li>it mentions a person, place or event</li>
 * <li>sad, angry or anxious, with moderate importance or long content</li>
 * </ul>
 */
public class DiaryFilter {

    private static final Set<String> POSITIVE = Set.of("happy", "excited");
    private static final Set<String> NEGATIVE = Set.of("sad", "angry", "anxious");

    private final MemoryProperties.DiaryProperties config;

    public DiaryFilter(MemoryProperties.DiaryProperties config) {
        this.config = config;
    }

    /**
     * @param recent
     *            existing entries, oldest first
     * @param todayEntries
     *            entries written today
     * @param todayHappyEntries
     *            happy or excited entries written today
     * @param lastEntryAt
     *            time of the most recent entry, null if none
     */
    public DiaryDecision evaluate(DiaryCandidate candidate, List<DiaryEntry> recent, int todayEntries,
            int todayHappyEntries, Instant lastEntryAt, Instant now) {
        String content = candidate.content() != null ? candidate.content().trim() : "";
        if (content.length() < config.getMinContentLength()) {
            return DiaryDecision.TOO_SHORT;
        }
        if (isDuplicate(content, recent)) {
            return DiaryDecision.DUPLICATE;
        }
        if (todayEntries >= config.getDailyEntryCap()) {
            return DiaryDecision.DAILY_CAP_REACHED;
        }
        boolean important = candidate.importance() >= config.getImportanceThreshold();
        if (!important && lastEntryAt != null
                && Duration.between(lastEntryAt, now).toSeconds() < config.getMinIntervalSeconds()) {
            return DiaryDecision.TOO_SOON;
        }
        return isNotable(candidate, content, todayHappyEntries) ? DiaryDecision.SAVED : DiaryDecision.NOT_NOTABLE;
    }

    boolean isNotable(DiaryCandidate candidate, String content, int todayHappyEntries) {
        if (candidate.importance() >= config.getImportanceThreshold()) {
            return true;
        }
        String emotion = candidate.emotion() != null ? candidate.emotion().toLowerCase(Locale.ROOT) : "";
        boolean longContent = content.length() >= config.getLongContentLength();
        if (POSITIVE.contains(emotion)
                && (candidate.importance() >= config.getHappyImportanceThreshold() || longContent
                        || candidate.mentionsPeoplePlaceOrEvent())
                && todayHappyEntries < config.getDailyHappyCap()) {
            return true;
        }
        if (candidate.mentionsPeoplePlaceOrEvent()) {
            return true;
        }
        return NEGATIVE.contains(emotion)
                && (candidate.importance() >= config.getNegativeImportanceThreshold() || longContent);
    }

    /**
     * Exact-hash or fuzzy match against the recent window only.
     */
    boolean isDuplicate(String content, List<DiaryEntry> recent) {
        String hash = ContentHash.of(content);
        int from = Math.max(0, recent.size() - config.getDedupWindow());
        for (DiaryEntry entry : recent.subList(from, recent.size())) {
            if (hash.equals(entry.getContentHash())) {
                return true;
            }
            if (TextSimilarity.characterJaccard(content, entry.getContent()) >= config.getFuzzyThreshold()) {
                return true;
            }
        }
        return false;
    }

    public static boolean isHappy(String emotion) {
        return emotion != null && POSITIVE.contains(emotion.toLowerCase(Locale.ROOT));
    }
}
