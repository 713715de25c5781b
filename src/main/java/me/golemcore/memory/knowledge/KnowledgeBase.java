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

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.cache.CacheLayer;
import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.domain.model.RerankContext;
import me.golemcore.memory.domain.model.RetrievalCandidate;
import me.golemcore.memory.graph.KnowledgeGraph;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.persistence.JsonDocumentStore;
import me.golemcore.memory.quality.KnowledgeQualityManager;
import me.golemcore.memory.quality.QualityAssessment;
import me.golemcore.memory.retrieval.EmbeddingStore;
import me.golemcore.memory.retrieval.HybridRetriever;
import me.golemcore.memory.retrieval.QueryExpander;
import me.golemcore.memory.retrieval.Reranker;
import me.golemcore.memory.task.BackgroundTaskQueue;
import me.golemcore.memory.text.ContentHash;
import me.golemcore.memory.text.KeywordExtractor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Knowledge base ("lore book") of one owner, persisted as
 * {@code lore_books.json}.
 *
 * <p>
 * Every mutation takes the owner lock, applies the change to the in-memory
 * map, replaces the JSON document, and only then refreshes the vector index,
 * the caches and the lexical index. The knowledge graph is synchronised
 * through the background task queue. Stored entries are never modified in
 * place; a changed entry replaces the previous object, so a failed write can
 * restore the previous map.
 */
@Slf4j
public class KnowledgeBase {

    public static final String DEFAULT_CATEGORY = "general";
    public static final String SOURCE_MANUAL = "manual";
    public static final String SOURCE_FILE = "file";

    private static final String ALL_KEY = "list";
    private static final String STATISTICS_KEY = "summary";
    private static final String ID_PREFIX = "lore_";
    private static final int ID_HASH_LENGTH = 16;
    private static final int MAX_CHUNK_LENGTH = 500;
    private static final int MAX_TITLE_LENGTH = 30;
    private static final int LEARNED_KEYWORDS = 5;
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[。！？.!?])");

    private static final TypeReference<List<KnowledgeEntry>> ENTRY_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<KnowledgeHit>> HIT_LIST = new TypeReference<>() {
    };
    private static final TypeReference<KnowledgeStatistics> STATISTICS = new TypeReference<>() {
    };

    private final JsonDocumentStore<List<KnowledgeEntry>> store;
    private final EmbeddingStore embeddings;
    private final CacheLayer cache;
    private final KnowledgeGraph graph;
    private final KnowledgeQualityManager qualityManager;
    private final QueryExpander queryExpander;
    private final BackgroundTaskQueue taskQueue;
    private final HybridRetriever hybrid;
    private final Reranker reranker;
    private final UsageCountBuffer usage;
    private final MemoryProperties properties;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, KnowledgeEntry> entries = new LinkedHashMap<>();
    private final Map<String, String> idsByContent = new HashMap<>();
    private final AtomicLong writeVersion = new AtomicLong();

    public KnowledgeBase(JsonDocumentStore<List<KnowledgeEntry>> store, EmbeddingStore embeddings, CacheLayer cache,
            KnowledgeGraph graph, KnowledgeQualityManager qualityManager, QueryExpander queryExpander,
            BackgroundTaskQueue taskQueue, MemoryProperties properties, Clock clock) {
        this.store = store;
        this.embeddings = embeddings;
        this.cache = cache;
        this.graph = graph;
        this.qualityManager = qualityManager;
        this.queryExpander = queryExpander;
        this.taskQueue = taskQueue;
        this.properties = properties;
        this.clock = clock;
        this.hybrid = new HybridRetriever(embeddings, this::corpus, properties.getHybrid());
        this.reranker = new Reranker(properties.getRerank(), clock);
        this.usage = new UsageCountBuffer(properties.getUsage().getFlushThreshold(),
                Duration.ofSeconds(properties.getUsage().getFlushIntervalSeconds()), clock);
    }

    public void load() {
        lock.lock();
        try {
            entries.clear();
            idsByContent.clear();
            for (KnowledgeEntry entry : store.load()) {
                if (entry == null || isBlank(entry.getContent())) {
                    continue;
                }
                KnowledgeEntry normalized = normalize(entry.copy(), entry.getSource());
                entries.put(normalized.getId(), normalized);
                idsByContent.put(contentKey(normalized), normalized.getId());
            }
            embeddings.clear();
            embeddings.index(entries.values().stream().map(KnowledgeBase::toVectorDocument).toList());
            hybrid.invalidate();
            cache.clear();
            log.info("[KnowledgeBase] Loaded {} entries", entries.size());
        } finally {
            lock.unlock();
        }
    }

    // ==================== Writes ====================

    /**
     * Add one entry. An entry with the same title and content as a stored one
     * is not added again.
     *
     * @return id of the stored entry (the existing one for a duplicate)
     */
    public String add(KnowledgeEntry draft) {
        List<Insert> inserts = insert(List.of(draft), SOURCE_MANUAL);
        return inserts.get(0).id();
    }

    /**
     * Add many entries with one durable write and one vector batch.
     *
     * @return ids of the newly stored entries
     */
    public List<String> addAll(List<KnowledgeEntry> drafts) {
        return insert(drafts, SOURCE_MANUAL).stream().filter(Insert::created).map(Insert::id).toList();
    }

    /**
     * Split text into paragraph chunks and store each as an entry, in a single
     * batch.
     *
     * @return ids of the newly stored entries
     */
    public List<String> learnFromText(String text, String category, String source) {
        if (isBlank(text)) {
            return List.of();
        }
        List<KnowledgeEntry> drafts = new ArrayList<>();
        for (String chunk : chunk(text)) {
            drafts.add(KnowledgeEntry.builder()
                    .title(titleOf(chunk))
                    .content(chunk)
                    .category(isBlank(category) ? DEFAULT_CATEGORY : category)
                    .keywords(KeywordExtractor.extract(chunk, LEARNED_KEYWORDS))
                    .source(isBlank(source) ? SOURCE_FILE : source)
                    .build());
        }
        List<String> ids = insert(drafts, SOURCE_FILE).stream().filter(Insert::created).map(Insert::id).toList();
        log.info("[KnowledgeBase] Learned {} entries from {} chunks", ids.size(), drafts.size());
        return ids;
    }

    /**
     * Apply the non-null fields of {@code patch} to entry {@code id}.
     *
     * @return false if no such entry exists
     */
    public boolean update(String id, KnowledgeEntry patch) {
        requireId(id);
        KnowledgeEntry updated;
        lock.lock();
        try {
            KnowledgeEntry current = entries.get(id);
            if (current == null) {
                return false;
            }
            KnowledgeEntry.KnowledgeEntryBuilder builder = current.copy().toBuilder()
                    .updateCount(current.getUpdateCount() + 1);
            if (patch.getTitle() != null) {
                builder.title(patch.getTitle());
            }
            if (patch.getContent() != null) {
                if (patch.getContent().isBlank()) {
                    throw new IllegalArgumentException("content must not be blank");
                }
                builder.content(patch.getContent());
            }
            if (patch.getCategory() != null) {
                builder.category(patch.getCategory());
            }
            if (patch.getKeywords() != null && !patch.getKeywords().isEmpty()) {
                builder.keywords(new LinkedHashSet<>(patch.getKeywords()));
            }
            if (patch.getSource() != null) {
                builder.source(patch.getSource());
            }
            updated = builder.build();

            Map<String, KnowledgeEntry> before = new LinkedHashMap<>(entries);
            entries.put(id, updated);
            persistOrRollback(before);
            idsByContent.values().remove(id);
            idsByContent.put(contentKey(updated), id);
            embeddings.index(List.of(toVectorDocument(updated)));
            afterWrite(true);
        } finally {
            lock.unlock();
        }
        syncGraph(List.of(updated.copy()));
        assessQuality(List.of(updated));
        return true;
    }

    public boolean delete(String id) {
        requireId(id);
        return deleteMany(List.of(id)) > 0;
    }

    /**
     * Delete several entries with one durable write.
     *
     * @return number of entries removed
     */
    public int deleteMany(Collection<String> ids) {
        List<String> removed = new ArrayList<>();
        lock.lock();
        try {
            Map<String, KnowledgeEntry> before = new LinkedHashMap<>(entries);
            for (String id : ids) {
                if (id != null && entries.remove(id) != null) {
                    removed.add(id);
                }
            }
            if (removed.isEmpty()) {
                return 0;
            }
            persistOrRollback(before);
            idsByContent.values().removeAll(removed);
            embeddings.delete(removed);
            usage.discard(removed);
            afterWrite(true);
        } finally {
            lock.unlock();
        }
        taskQueue.submit("graph-delete", () -> graph.deleteNodes(removed), BackgroundTaskQueue.Overflow.CALLER_RUNS);
        log.debug("[KnowledgeBase] Deleted {} entries", removed.size());
        return removed.size();
    }

    public void recordUsage(Collection<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        usage.increment(ids);
        if (usage.shouldFlush()) {
            flushUsage();
        }
    }

    /**
     * Write buffered usage counts if the threshold or the interval is reached.
     */
    public void flushUsageIfDue() {
        if (usage.shouldFlush()) {
            flushUsage();
        }
    }

    /**
     * Write every buffered usage count now. On failure the increments go back
     * into the buffer.
     */
    public void flushUsage() {
        lock.lock();
        try {
            Map<String, Integer> drained = usage.drain();
            if (drained.isEmpty()) {
                return;
            }
            Map<String, KnowledgeEntry> before = new LinkedHashMap<>(entries);
            Instant now = clock.instant();
            drained.forEach((id, count) -> entries.computeIfPresent(id, (key, entry) -> entry.copy().toBuilder()
                    .usageCount(entry.getUsageCount() + count)
                    .lastUsed(now)
                    .build()));
            try {
                persistOrRollback(before);
            } catch (IllegalStateException e) {
                usage.restore(drained);
                log.warn("[KnowledgeBase] Usage flush failed, {} ids kept in buffer: {}", drained.size(),
                        e.getMessage());
                return;
            }
            writeVersion.incrementAndGet();
            cache.invalidate(CacheLayer.ALL_ENTRIES, ALL_KEY);
            cache.invalidate(CacheLayer.STATISTICS, STATISTICS_KEY);
            log.debug("[KnowledgeBase] Flushed usage of {} entries", drained.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return false if no such entry exists
     */
    public boolean recordFeedback(String id, boolean positive) {
        requireId(id);
        lock.lock();
        try {
            KnowledgeEntry current = entries.get(id);
            if (current == null) {
                return false;
            }
            Map<String, KnowledgeEntry> before = new LinkedHashMap<>(entries);
            entries.put(id, current.copy().toBuilder()
                    .positiveFeedback(current.getPositiveFeedback() + (positive ? 1 : 0))
                    .negativeFeedback(current.getNegativeFeedback() + (positive ? 0 : 1))
                    .build());
            persistOrRollback(before);
            writeVersion.incrementAndGet();
            cache.invalidate(CacheLayer.ALL_ENTRIES, ALL_KEY);
            cache.invalidate(CacheLayer.STATISTICS, STATISTICS_KEY);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Import exported records. Records whose id or content is already present
     * are skipped unless {@code overwrite} is set, in which case a record
     * replaces the stored entry with the same id.
     */
    public ImportReport importRecords(List<KnowledgeEntry> records, boolean overwrite) {
        int imported = 0;
        int skipped = 0;
        int invalid = 0;
        List<KnowledgeEntry> changed = new ArrayList<>();
        lock.lock();
        try {
            Map<String, KnowledgeEntry> before = new LinkedHashMap<>(entries);
            Map<String, String> contentBefore = new HashMap<>(idsByContent);
            for (KnowledgeEntry record : records) {
                if (record == null || isBlank(record.getContent())) {
                    invalid++;
                    continue;
                }
                KnowledgeEntry entry = normalize(record.copy(), "import");
                String key = contentKey(entry);
                String existingByContent = idsByContent.get(key);
                boolean exists = entries.containsKey(entry.getId());
                if (!overwrite && (exists || existingByContent != null)) {
                    skipped++;
                    continue;
                }
                if (existingByContent != null && !existingByContent.equals(entry.getId())) {
                    skipped++;
                    continue;
                }
                if (exists) {
                    idsByContent.values().remove(entry.getId());
                }
                entries.put(entry.getId(), entry);
                idsByContent.put(key, entry.getId());
                changed.add(entry);
                imported++;
            }
            if (!changed.isEmpty()) {
                try {
                    persistOrRollback(before);
                } catch (IllegalStateException e) {
                    idsByContent.clear();
                    idsByContent.putAll(contentBefore);
                    throw e;
                }
                embeddings.index(changed.stream().map(KnowledgeBase::toVectorDocument).toList());
                afterWrite(true);
            }
        } finally {
            lock.unlock();
        }
        if (!changed.isEmpty()) {
            syncGraph(changed.stream().map(KnowledgeEntry::copy).toList());
        }
        log.info("[KnowledgeBase] Import: {} imported, {} skipped, {} invalid", imported, skipped, invalid);
        return new ImportReport(imported, skipped, invalid);
    }

    /**
     * Copies of all entries with buffered usage applied.
     */
    public List<KnowledgeEntry> export() {
        flushUsage();
        lock.lock();
        try {
            return entries.values().stream().map(KnowledgeEntry::copy).toList();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            Map<String, KnowledgeEntry> before = new LinkedHashMap<>(entries);
            entries.clear();
            persistOrRollback(before);
            idsByContent.clear();
            usage.clear();
            embeddings.clear();
            afterWrite(true);
            graph.clear();
        } finally {
            lock.unlock();
        }
        log.info("[KnowledgeBase] Cleared");
    }

    /**
     * Run the quality assessment synchronously and attach it to the entry.
     */
    public Optional<QualityAssessment> assess(String id) {
        Optional<KnowledgeEntry> entry = get(id);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        QualityAssessment assessment = qualityManager.assess(entry.get(), all());
        applyQuality(assessment);
        return Optional.of(assessment);
    }

    // ==================== Reads ====================

    public Optional<KnowledgeEntry> get(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(id)).map(KnowledgeEntry::copy);
        } finally {
            lock.unlock();
        }
    }

    public List<KnowledgeEntry> all() {
        Duration ttl = Duration.ofSeconds(properties.getCache().getDefaultTtlSeconds());
        Optional<List<KnowledgeEntry>> cached = cache.get(CacheLayer.ALL_ENTRIES, ALL_KEY, ENTRY_LIST, ttl);
        if (cached.isPresent()) {
            return cached.get().stream().map(KnowledgeEntry::copy).toList();
        }
        List<KnowledgeEntry> snapshot;
        lock.lock();
        try {
            snapshot = entries.values().stream().map(KnowledgeEntry::copy).toList();
            cache.put(CacheLayer.ALL_ENTRIES, ALL_KEY, snapshot, ttl);
        } finally {
            lock.unlock();
        }
        return snapshot.stream().map(KnowledgeEntry::copy).toList();
    }

    public List<KnowledgeHit> search(String query, int k, String category) {
        return search(query, k, category, true, true, RerankContext.empty(), true);
    }

    /**
     * Search the knowledge base.
     *
     * <p>
     * The plain path ranks by vector similarity and falls back to lexical
     * scores when embeddings are unavailable. The hybrid path fuses vector and
     * BM25 scores, expands the query when enabled, and reranks when
     * {@code useRerank} is set. The conversation context only takes part in
     * the result (and in the cache key) on the hybrid reranked path.
     */
    public List<KnowledgeHit> search(String query, int k, String category, boolean useHybrid, boolean useRerank,
            RerankContext context, boolean useCache) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative");
        }
        if (isBlank(query) || k == 0) {
            return List.of();
        }
        boolean contextual = useHybrid && useRerank;
        String key = searchKey(query, k, category, useHybrid, useRerank, contextual ? context : null);
        Duration ttl = Duration.ofSeconds(properties.getCache().getSearchTtlSeconds());

        List<KnowledgeHit> hits = useCache ? cache.get(CacheLayer.SEARCH, key, HIT_LIST, ttl).orElse(null) : null;
        if (hits == null) {
            hits = useHybrid ? hybridSearch(query, k, category, useRerank, context) : vectorSearch(query, k, category);
            if (useCache) {
                cache.put(CacheLayer.SEARCH, key, hits, ttl);
            }
        }
        recordUsage(hits.stream().map(hit -> hit.entry().getId()).toList());
        return hits.stream()
                .map(hit -> new KnowledgeHit(hit.entry().copy(), hit.score(), hit.finalScore(), hit.breakdown()))
                .toList();
    }

    public KnowledgeStatistics statistics() {
        Duration ttl = Duration.ofSeconds(properties.getCache().getStatisticsTtlSeconds());
        Optional<KnowledgeStatistics> cached = cache.get(CacheLayer.STATISTICS, STATISTICS_KEY, STATISTICS, ttl);
        if (cached.isPresent()) {
            return cached.get();
        }
        lock.lock();
        try {
            Map<String, Integer> byCategory = new TreeMap<>();
            Map<String, Integer> bySource = new TreeMap<>();
            long totalUsage = 0;
            long positive = 0;
            long negative = 0;
            double qualitySum = 0.0;
            int rated = 0;
            for (KnowledgeEntry entry : entries.values()) {
                byCategory.merge(orDefault(entry.getCategory(), DEFAULT_CATEGORY), 1, Integer::sum);
                bySource.merge(orDefault(entry.getSource(), SOURCE_MANUAL), 1, Integer::sum);
                totalUsage += entry.getUsageCount();
                positive += entry.getPositiveFeedback();
                negative += entry.getNegativeFeedback();
                if (entry.getQualityScore() != null) {
                    qualitySum += entry.getQualityScore();
                    rated++;
                }
            }
            KnowledgeStatistics statistics = new KnowledgeStatistics(entries.size(), byCategory, bySource,
                    totalUsage, positive, negative, rated > 0 ? qualitySum / rated : null, usage.pendingTotal());
            cache.put(CacheLayer.STATISTICS, STATISTICS_KEY, statistics, ttl);
            return statistics;
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

    public int pendingUsage() {
        return usage.pendingTotal();
    }

    public KnowledgeGraph getGraph() {
        return graph;
    }

    // ==================== Internals ====================

    private List<Insert> insert(List<KnowledgeEntry> drafts, String defaultSource) {
        List<Insert> results = new ArrayList<>(drafts.size());
        List<KnowledgeEntry> created = new ArrayList<>();
        lock.lock();
        try {
            Map<String, KnowledgeEntry> before = new LinkedHashMap<>(entries);
            for (KnowledgeEntry draft : drafts) {
                if (draft == null || isBlank(draft.getContent())) {
                    throw new IllegalArgumentException("knowledge content must not be blank");
                }
                KnowledgeEntry entry = normalize(draft.copy(), defaultSource);
                entry.setTimestamp(clock.instant());
                entry.setUpdateCount(0);
                String key = contentKey(entry);
                String existing = idsByContent.get(key);
                if (existing == null && entries.containsKey(entry.getId())) {
                    existing = entry.getId();
                }
                if (existing != null) {
                    results.add(new Insert(existing, false));
                    continue;
                }
                entries.put(entry.getId(), entry);
                idsByContent.put(key, entry.getId());
                created.add(entry);
                results.add(new Insert(entry.getId(), true));
            }
            if (created.isEmpty()) {
                return results;
            }
            try {
                persistOrRollback(before);
            } catch (IllegalStateException e) {
                created.forEach(entry -> idsByContent.remove(contentKey(entry)));
                throw e;
            }
            embeddings.index(created.stream().map(KnowledgeBase::toVectorDocument).toList());
            afterWrite(true);
        } finally {
            lock.unlock();
        }
        syncGraph(created.stream().map(KnowledgeEntry::copy).toList());
        assessQuality(created);
        return results;
    }

    private List<KnowledgeHit> vectorSearch(String query, int k, String category) {
        if (!embeddings.isAvailable()) {
            return lexicalSearch(query, k, category);
        }
        List<EmbeddingStore.VectorHit> vectorHits;
        try {
            vectorHits = embeddings.search(query, category == null ? k : k * 3);
        } catch (IllegalStateException e) {
            log.warn("[KnowledgeBase] Vector search failed, falling back to lexical search: {}", e.getMessage());
            return lexicalSearch(query, k, category);
        }
        List<KnowledgeHit> hits = new ArrayList<>();
        lock.lock();
        try {
            for (EmbeddingStore.VectorHit hit : vectorHits) {
                KnowledgeEntry entry = entries.get(hit.id());
                if (entry == null || (category != null && !category.equals(entry.getCategory()))) {
                    continue;
                }
                hits.add(new KnowledgeHit(entry.copy(), hit.similarity(), null, null));
                if (hits.size() >= k) {
                    break;
                }
            }
        } finally {
            lock.unlock();
        }
        return hits;
    }

    private List<KnowledgeHit> lexicalSearch(String query, int k, String category) {
        return toHits(hybrid.search(query, k, category, 0.0, 0.0), false);
    }

    private List<KnowledgeHit> hybridSearch(String query, int k, String category, boolean useRerank,
            RerankContext context) {
        List<String> queries = properties.getQueryExpansion().isEnabled()
                ? queryExpander.expand(query, properties.getQueryExpansion().getMaxExpansions()).queries()
                : List.of(query);
        int fetch = useRerank ? k * 2 : k;

        Map<String, RetrievalCandidate> merged = new LinkedHashMap<>();
        for (String expanded : queries) {
            for (RetrievalCandidate candidate : hybrid.search(expanded, fetch, category)) {
                merged.merge(candidate.getId(), candidate,
                        (left, right) -> right.getScore() > left.getScore() ? right : left);
            }
        }
        List<RetrievalCandidate> candidates = refresh(merged.values());
        if (useRerank) {
            candidates = reranker.rerank(candidates, query, context);
        } else {
            candidates = candidates.stream()
                    .sorted(Comparator.comparingDouble(RetrievalCandidate::getScore).reversed()
                            .thenComparingInt(RetrievalCandidate::getVectorRank))
                    .toList();
        }
        return toHits(candidates.stream().limit(k).toList(), useRerank);
    }

    /**
     * Current usage, quality and keywords for candidates scored against a
     * possibly older lexical index. Candidates of deleted entries are dropped.
     */
    private List<RetrievalCandidate> refresh(Collection<RetrievalCandidate> candidates) {
        lock.lock();
        try {
            List<RetrievalCandidate> refreshed = new ArrayList<>(candidates.size());
            for (RetrievalCandidate candidate : candidates) {
                KnowledgeEntry entry = entries.get(candidate.getId());
                if (entry == null) {
                    continue;
                }
                refreshed.add(candidate.toBuilder()
                        .category(entry.getCategory())
                        .keywords(new LinkedHashSet<>(entry.getKeywords()))
                        .timestamp(entry.getTimestamp())
                        .importance(entry.getQualityScore())
                        .usageCount(entry.getUsageCount() + usage.pendingFor(entry.getId()))
                        .build());
            }
            return refreshed;
        } finally {
            lock.unlock();
        }
    }

    private List<KnowledgeHit> toHits(List<RetrievalCandidate> candidates, boolean reranked) {
        lock.lock();
        try {
            List<KnowledgeHit> hits = new ArrayList<>(candidates.size());
            for (RetrievalCandidate candidate : candidates) {
                KnowledgeEntry entry = entries.get(candidate.getId());
                if (entry != null) {
                    hits.add(new KnowledgeHit(entry.copy(), candidate.getScore(),
                            reranked ? candidate.getFinalScore() : null, reranked ? candidate.getBreakdown() : null));
                }
            }
            return hits;
        } finally {
            lock.unlock();
        }
    }

    private List<RetrievalCandidate> corpus() {
        lock.lock();
        try {
            return entries.values().stream()
                    .map(entry -> RetrievalCandidate.builder()
                            .id(entry.getId())
                            .content(searchableText(entry))
                            .category(entry.getCategory())
                            .keywords(new LinkedHashSet<>(entry.getKeywords()))
                            .timestamp(entry.getTimestamp())
                            .importance(entry.getQualityScore())
                            .usageCount(entry.getUsageCount())
                            .build())
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    private void applyQuality(QualityAssessment assessment) {
        lock.lock();
        try {
            KnowledgeEntry current = entries.get(assessment.entryId());
            if (current == null) {
                return;
            }
            Map<String, KnowledgeEntry> before = new LinkedHashMap<>(entries);
            entries.put(current.getId(), current.copy().toBuilder()
                    .qualityScore(assessment.qualityScore())
                    .qualityIssues(new ArrayList<>(assessment.issues()))
                    .build());
            persistOrRollback(before);
            afterWrite(false);
        } finally {
            lock.unlock();
        }
    }

    private void assessQuality(List<KnowledgeEntry> changed) {
        if (!properties.getQuality().isAssessOnWrite()) {
            return;
        }
        for (KnowledgeEntry entry : changed) {
            qualityManager.assessAsync(entry, this::all, this::applyQuality);
        }
    }

    private void syncGraph(List<KnowledgeEntry> changed) {
        if (changed.isEmpty()) {
            return;
        }
        taskQueue.submit("graph-sync", () -> graph.upsertMany(changed, true),
                BackgroundTaskQueue.Overflow.CALLER_RUNS);
    }

    private void persistOrRollback(Map<String, KnowledgeEntry> before) {
        try {
            store.save(new ArrayList<>(entries.values()));
        } catch (IllegalStateException e) {
            entries.clear();
            entries.putAll(before);
            log.warn("[KnowledgeBase] Write failed, in-memory state restored: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Invalidate derived state after a successful durable write.
     *
     * @param textChanged
     *            whether searchable text or membership changed, which makes
     *            the lexical index stale
     */
    private void afterWrite(boolean textChanged) {
        writeVersion.incrementAndGet();
        if (textChanged) {
            hybrid.invalidate();
        }
        cache.invalidateNamespace(CacheLayer.SEARCH);
        cache.invalidate(CacheLayer.ALL_ENTRIES, ALL_KEY);
        cache.invalidate(CacheLayer.STATISTICS, STATISTICS_KEY);
    }

    private KnowledgeEntry normalize(KnowledgeEntry entry, String defaultSource) {
        if (isBlank(entry.getTitle())) {
            entry.setTitle(titleOf(entry.getContent()));
        }
        if (isBlank(entry.getCategory())) {
            entry.setCategory(DEFAULT_CATEGORY);
        }
        if (isBlank(entry.getSource())) {
            entry.setSource(defaultSource);
        }
        if (entry.getKeywords() == null) {
            entry.setKeywords(new LinkedHashSet<>());
        }
        if (entry.getQualityIssues() == null) {
            entry.setQualityIssues(new ArrayList<>());
        }
        if (entry.getTimestamp() == null) {
            entry.setTimestamp(clock.instant());
        }
        if (isBlank(entry.getId())) {
            entry.setId(ID_PREFIX + contentKey(entry).substring(0, ID_HASH_LENGTH));
        }
        return entry;
    }

    private static String contentKey(KnowledgeEntry entry) {
        return ContentHash.of(orDefault(entry.getTitle(), "") + "\n" + entry.getContent());
    }

    private static String searchKey(String query, int k, String category, boolean useHybrid, boolean useRerank,
            RerankContext context) {
        StringBuilder key = new StringBuilder()
                .append(query).append('|').append(k).append('|').append(category)
                .append('|').append(useHybrid).append('|').append(useRerank);
        if (context != null) {
            key.append('|').append(context.category()).append('|')
                    .append(new TreeSet<>(context.keywordsOrEmpty()));
        }
        return ContentHash.md5(key.toString());
    }

    static List<String> chunk(String text) {
        List<String> chunks = new ArrayList<>();
        for (String paragraph : PARAGRAPH_BREAK.split(text.replace("\r\n", "\n"))) {
            String trimmed = paragraph.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.length() <= MAX_CHUNK_LENGTH) {
                chunks.add(trimmed);
                continue;
            }
            StringBuilder current = new StringBuilder();
            for (String sentence : SENTENCE_END.split(trimmed)) {
                if (current.length() > 0 && current.length() + sentence.length() > MAX_CHUNK_LENGTH) {
                    chunks.add(current.toString().trim());
                    current.setLength(0);
                }
                current.append(sentence);
            }
            if (!current.toString().isBlank()) {
                chunks.add(current.toString().trim());
            }
        }
        return chunks;
    }

    static String titleOf(String content) {
        String firstLine = content.strip().lines().findFirst().orElse("").strip();
        return firstLine.length() <= MAX_TITLE_LENGTH ? firstLine : firstLine.substring(0, MAX_TITLE_LENGTH) + "...";
    }

    private static EmbeddingStore.VectorDocument toVectorDocument(KnowledgeEntry entry) {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("content", searchableText(entry));
        metadata.put("category", orDefault(entry.getCategory(), DEFAULT_CATEGORY));
        metadata.put("title", orDefault(entry.getTitle(), ""));
        return new EmbeddingStore.VectorDocument(entry.getId(), searchableText(entry), metadata);
    }

    private static String searchableText(KnowledgeEntry entry) {
        return orDefault(entry.getTitle(), "") + "\n" + entry.getContent();
    }

    private static void requireId(String id) {
        if (isBlank(id)) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }

    private record Insert(String id, boolean created) {
    }
}
