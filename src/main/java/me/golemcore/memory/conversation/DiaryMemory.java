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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.DiaryEntry;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.llm.LlmJsonClient;
import me.golemcore.memory.persistence.JsonDocumentStore;
import me.golemcore.memory.text.ContentHash;
import me.golemcore.memory.text.KeywordExtractor;
import me.golemcore.memory.text.TextTokenizer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Diary of one owner ({@code diary.json}).
 *
 * <p>
 * Candidates pass through {@link DiaryFilter}; rejected interactions are kept
 * in a same-day buffer that feeds the daily summary. Each accepted write is
 * followed by a retention pass: entries older than {@code maxAgeDays} are
 * dropped unless their importance exceeds the protection threshold, and the
 * least important unprotected entries are evicted above {@code maxItems}.
 */
@Slf4j
public class DiaryMemory {

    public static final String SUMMARY_TOPIC = "daily_summary";
    private static final String DEFAULT_TOPIC = "daily";
    private static final double SUMMARY_IMPORTANCE = 0.8;
    private static final int HIGHLIGHTS = 3;
    private static final int HIGHLIGHT_LENGTH = 60;

    private static final int MAX_LOOKBACK_DAYS = 3650;
    private static final Pattern DAYS_AGO = Pattern.compile("(\\d+)\\s*(?:days?\\s+ago|天前)");
    private static final Map<String, int[]> TIME_RANGES = new LinkedHashMap<>();

    static {
        // keyword -> {first day back, last day back}, 0 = today
        TIME_RANGES.put("day before yesterday", new int[] {2, 2});
        TIME_RANGES.put("前天", new int[] {2, 2});
        TIME_RANGES.put("yesterday", new int[] {1, 1});
        TIME_RANGES.put("昨天", new int[] {1, 1});
        TIME_RANGES.put("today", new int[] {0, 0});
        TIME_RANGES.put("今天", new int[] {0, 0});
        TIME_RANGES.put("last week", new int[] {0, 7});
        TIME_RANGES.put("上周", new int[] {0, 7});
        TIME_RANGES.put("last month", new int[] {0, 30});
        TIME_RANGES.put("上个月", new int[] {0, 30});
        TIME_RANGES.put("recently", new int[] {0, 7});
        TIME_RANGES.put("最近", new int[] {0, 7});
    }

    private final JsonDocumentStore<List<DiaryEntry>> store;
    private final DiaryFilter filter;
    private final MemoryProperties.DiaryProperties config;
    private final LlmJsonClient llm;
    private final Clock clock;
    private final ZoneId zone;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong writeVersion = new AtomicLong();

    private final List<DiaryEntry> entries = new ArrayList<>();
    private final List<String> dailyConversations = new ArrayList<>();
    private LocalDate bufferDay;
    private LocalDate lastSummaryDay;

    public DiaryMemory(JsonDocumentStore<List<DiaryEntry>> store, MemoryProperties.DiaryProperties config,
            LlmJsonClient llm, Clock clock) {
        this.store = store;
        this.filter = new DiaryFilter(config);
        this.config = config;
        this.llm = llm;
        this.clock = clock;
        this.zone = clock.getZone();
    }

    public void load() {
        lock.lock();
        try {
            entries.clear();
            for (DiaryEntry entry : store.load()) {
                if (entry == null || entry.getContent() == null) {
                    continue;
                }
                if (entry.getEmotion() == null) {
                    entry.setEmotion("neutral");
                }
                if (entry.getContentHash() == null) {
                    entry.setContentHash(ContentHash.of(entry.getContent()));
                }
                entries.add(entry);
            }
            entries.sort(Comparator.comparing(DiaryEntry::getTimestamp,
                    Comparator.nullsFirst(Comparator.naturalOrder())));
            log.info("[Diary] Loaded {} entries", entries.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Offer an interaction to the diary.
     */
    public DiaryDecision addEntry(DiaryCandidate candidate) {
        lock.lock();
        try {
            Instant now = clock.instant();
            LocalDate today = LocalDate.ofInstant(now, zone);
            List<DiaryEntry> todays = entriesOn(today);
            int happyToday = (int) todays.stream().filter(entry -> DiaryFilter.isHappy(entry.getEmotion())).count();
            Instant lastEntryAt = entries.isEmpty() ? null : entries.get(entries.size() - 1).getTimestamp();

            DiaryDecision decision = filter.evaluate(candidate, entries, todays.size(), happyToday, lastEntryAt,
                    now);
            if (!decision.isSaved()) {
                if (decision != DiaryDecision.TOO_SHORT && decision != DiaryDecision.DUPLICATE) {
                    bufferConversation(candidate.content(), today);
                }
                log.debug("[Diary] Not saved: {}", decision);
                return decision;
            }

            String content = candidate.content().trim();
            DiaryEntry entry = DiaryEntry.builder()
                    .id(UUID.randomUUID().toString())
                    .content(content)
                    .timestamp(now)
                    .emotion(candidate.emotion() != null ? candidate.emotion() : "neutral")
                    .topic(topicOf(candidate))
                    .importance(Math.max(0.0, Math.min(1.0, candidate.importance())))
                    .people(new ArrayList<>(candidate.people()))
                    .location(candidate.location())
                    .event(candidate.event())
                    .contentHash(ContentHash.of(content))
                    .build();
            List<DiaryEntry> before = new ArrayList<>(entries);
            entries.add(entry);
            applyRetention(now);
            persistOrRollback(before);
            log.debug("[Diary] Saved entry {} ({})", entry.getId(), entry.getEmotion());
            return decision;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write the summary of today's conversations as a diary entry. Uses the
     * LLM when available, otherwise a rule-based digest.
     *
     * @param force
     *            summarise again even if today already has a summary
     */
    public Optional<DiaryEntry> generateDailySummary(boolean force) {
        lock.lock();
        try {
            Instant now = clock.instant();
            LocalDate today = LocalDate.ofInstant(now, zone);
            if (!force && today.equals(lastSummaryDay)) {
                return Optional.empty();
            }
            List<DiaryEntry> todays = entriesOn(today).stream()
                    .filter(entry -> !SUMMARY_TOPIC.equals(entry.getTopic()))
                    .toList();
            List<String> buffered = today.equals(bufferDay) ? new ArrayList<>(dailyConversations) : List.of();
            if (todays.isEmpty() && buffered.isEmpty()) {
                return Optional.empty();
            }

            String summary = llmSummary(today, todays, buffered).orElseGet(() -> digest(today, todays, buffered));
            DiaryEntry entry = DiaryEntry.builder()
                    .id(UUID.randomUUID().toString())
                    .content(summary)
                    .timestamp(now)
                    .emotion(dominantEmotion(todays))
                    .topic(SUMMARY_TOPIC)
                    .importance(SUMMARY_IMPORTANCE)
                    .contentHash(ContentHash.of(summary))
                    .build();
            List<DiaryEntry> before = new ArrayList<>(entries);
            entries.add(entry);
            persistOrRollback(before);
            dailyConversations.clear();
            lastSummaryDay = today;
            log.info("[Diary] Daily summary written for {}", today);
            return Optional.of(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Time-aware lookup: queries naming a period (today, yesterday, 3 days
     * ago, last week, recently ...) return that period's entries, newest
     * first; other queries fall back to {@link #searchByContent}.
     */
    public List<DiaryEntry> searchByTime(String query, int k) {
        Optional<int[]> range = timeRange(query);
        if (range.isEmpty()) {
            return searchByContent(query, k);
        }
        LocalDate today = LocalDate.ofInstant(clock.instant(), zone);
        LocalDate from = today.minusDays(range.get()[1]);
        LocalDate to = today.minusDays(range.get()[0]);
        lock.lock();
        try {
            return entries.stream()
                    .filter(entry -> entry.getTimestamp() != null)
                    .filter(entry -> {
                        LocalDate day = LocalDate.ofInstant(entry.getTimestamp(), zone);
                        return !day.isBefore(from) && !day.isAfter(to);
                    })
                    .sorted(Comparator.comparing(DiaryEntry::getTimestamp).reversed())
                    .limit(Math.max(0, k))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Entries sharing tokens with {@code query}, by overlap then importance.
     */
    public List<DiaryEntry> searchByContent(String query, int k) {
        Set<String> queryTokens = TextTokenizer.tokenSet(query);
        if (queryTokens.isEmpty() || k <= 0) {
            return List.of();
        }
        lock.lock();
        try {
            Map<DiaryEntry, Double> scores = new LinkedHashMap<>();
            for (DiaryEntry entry : entries) {
                Set<String> tokens = new HashSet<>(TextTokenizer.tokenSet(entry.getContent()));
                tokens.retainAll(queryTokens);
                if (!tokens.isEmpty()) {
                    scores.put(entry, (double) tokens.size() / queryTokens.size() + 0.1 * entry.getImportance());
                }
            }
            return scores.entrySet().stream()
                    .sorted(Map.Entry.<DiaryEntry, Double>comparingByValue().reversed())
                    .limit(k)
                    .map(Map.Entry::getKey)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public static boolean hasTimeKeyword(String query) {
        return timeRange(query).isPresent();
    }

    /**
     * Run the retention policy now.
     *
     * @return number of entries removed
     */
    public int prune() {
        lock.lock();
        try {
            List<DiaryEntry> before = new ArrayList<>(entries);
            int removed = applyRetention(clock.instant());
            if (removed > 0) {
                persistOrRollback(before);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public boolean delete(String id) {
        lock.lock();
        try {
            List<DiaryEntry> before = new ArrayList<>(entries);
            boolean removed = entries.removeIf(entry -> entry.getId().equals(id));
            if (removed) {
                persistOrRollback(before);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public List<DiaryEntry> all() {
        lock.lock();
        try {
            return entries.stream().map(entry -> entry.toBuilder().build()).toList();
        } finally {
            lock.unlock();
        }
    }

    public List<String> dailyConversations() {
        lock.lock();
        try {
            return List.copyOf(dailyConversations);
        } finally {
            lock.unlock();
        }
    }

    public int count() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public long writeVersion() {
        return writeVersion.get();
    }

    private int applyRetention(Instant now) {
        int before = entries.size();
        Instant cutoff = now.minus(Duration.ofDays(config.getMaxAgeDays()));
        entries.removeIf(entry -> !isProtected(entry) && entry.getTimestamp() != null
                && entry.getTimestamp().isBefore(cutoff));

        int excess = entries.size() - config.getMaxItems();
        if (excess > 0) {
            Set<DiaryEntry> evicted = entries.stream()
                    .filter(entry -> !isProtected(entry))
                    .sorted(Comparator.comparingDouble(DiaryEntry::getImportance)
                            .thenComparing(DiaryEntry::getTimestamp,
                                    Comparator.nullsFirst(Comparator.naturalOrder())))
                    .limit(excess)
                    .collect(Collectors.toCollection(() -> Collections.newSetFromMap(
                            new IdentityHashMap<>())));
            entries.removeIf(evicted::contains);
        }
        int removed = before - entries.size();
        if (removed > 0) {
            log.info("[Diary] Retention removed {} entries", removed);
        }
        return removed;
    }

    private boolean isProtected(DiaryEntry entry) {
        return entry.getImportance() > config.getProtectImportanceAbove();
    }

    private void bufferConversation(String content, LocalDate today) {
        if (!today.equals(bufferDay)) {
            dailyConversations.clear();
            bufferDay = today;
        }
        if (content != null && !content.isBlank()) {
            dailyConversations.add(content.trim());
        }
    }

    private List<DiaryEntry> entriesOn(LocalDate day) {
        return entries.stream()
                .filter(entry -> entry.getTimestamp() != null
                        && LocalDate.ofInstant(entry.getTimestamp(), zone).equals(day))
                .toList();
    }

    private Optional<String> llmSummary(LocalDate day, List<DiaryEntry> todays, List<String> buffered) {
        if (!llm.isAvailable()) {
            return Optional.empty();
        }
        StringBuilder prompt = new StringBuilder()
                .append("Write a short first-person diary summary (3-5 sentences) of the conversations on ")
                .append(day).append(". Mention the mood and the most important moments.\n\nNotable moments:\n");
        todays.forEach(entry -> prompt.append("- [").append(entry.getEmotion()).append("] ")
                .append(entry.getContent()).append('\n'));
        prompt.append("\nOther conversations:\n");
        buffered.forEach(text -> prompt.append("- ").append(text).append('\n'));
        return llm.completeText("daily summary", prompt.toString()).map(String::trim)
                .filter(text -> !text.isEmpty());
    }

    private static String digest(LocalDate day, List<DiaryEntry> todays, List<String> buffered) {
        StringBuilder summary = new StringBuilder("Daily summary ").append(day).append(": ")
                .append(todays.size() + buffered.size()).append(" conversations");
        Map<String, Long> moods = todays.stream()
                .collect(Collectors.groupingBy(DiaryEntry::getEmotion, LinkedHashMap::new, Collectors.counting()));
        if (!moods.isEmpty()) {
            summary.append(". Mood: ").append(moods.entrySet().stream()
                    .map(e -> e.getKey() + " x" + e.getValue())
                    .collect(Collectors.joining(", ")));
        }
        Set<String> topics = todays.stream().map(DiaryEntry::getTopic)
                .filter(topic -> topic != null && !DEFAULT_TOPIC.equals(topic))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (!topics.isEmpty()) {
            summary.append(". Topics: ").append(String.join(", ", topics));
        }
        List<String> highlights = todays.stream()
                .sorted(Comparator.comparingDouble(DiaryEntry::getImportance).reversed())
                .limit(HIGHLIGHTS)
                .map(entry -> abbreviate(entry.getContent()))
                .toList();
        if (!highlights.isEmpty()) {
            summary.append(". Highlights: ").append(String.join(" | ", highlights));
        }
        return summary.append('.').toString();
    }

    private static String dominantEmotion(List<DiaryEntry> todays) {
        return todays.stream()
                .collect(Collectors.groupingBy(DiaryEntry::getEmotion, Collectors.counting()))
                .entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse("neutral");
    }

    private static String topicOf(DiaryCandidate candidate) {
        if (candidate.event() != null && !candidate.event().isBlank()) {
            return candidate.event();
        }
        return KeywordExtractor.extract(candidate.content(), 1).stream().findFirst().orElse(DEFAULT_TOPIC);
    }

    private static Optional<int[]> timeRange(String query) {
        if (query == null) {
            return Optional.empty();
        }
        String lower = query.toLowerCase(Locale.ROOT);
        Matcher daysAgo = DAYS_AGO.matcher(lower);
        if (daysAgo.find()) {
            String digits = daysAgo.group(1);
            int days = digits.length() > 5 ? MAX_LOOKBACK_DAYS
                    : Math.min(Integer.parseInt(digits), MAX_LOOKBACK_DAYS);
            return Optional.of(new int[] {days, days});
        }
        for (Map.Entry<String, int[]> range : TIME_RANGES.entrySet()) {
            if (lower.contains(range.getKey())) {
                return Optional.of(range.getValue());
            }
        }
        return Optional.empty();
    }

    private static String abbreviate(String text) {
        return text.length() <= HIGHLIGHT_LENGTH ? text : text.substring(0, HIGHLIGHT_LENGTH) + "...";
    }

    private void persistOrRollback(List<DiaryEntry> before) {
        try {
            store.save(new ArrayList<>(entries));
        } catch (IllegalStateException e) {
            entries.clear();
            entries.addAll(before);
            log.warn("[Diary] Write failed, in-memory state restored: {}", e.getMessage());
            throw e;
        }
        writeVersion.incrementAndGet();
    }
}
