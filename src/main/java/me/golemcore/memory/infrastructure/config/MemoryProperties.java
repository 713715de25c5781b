package me.golemcore.memory.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the memory core.
 *
 * <p>
 * All configuration is organized under the {@code memory.*} prefix. This class
 * contains nested property classes for the different subsystems:
 * <ul>
 * <li>{@link StorageProperties} - durable JSON documents</li>
 * <li>{@link EmbeddingProperties}, {@link CompletionProperties} - model
 * backends</li>
 * <li>{@link CacheProperties} - L1/L2 caches</li>
 * <li>{@link RetrievalProperties}, {@link HybridProperties},
 * {@link RerankProperties} - retrieval pipeline</li>
 * <li>{@link GraphProperties} - knowledge graph extraction and traversal</li>
 * <li>{@link DiaryProperties}, {@link LongTermProperties},
 * {@link CoreMemoryProperties}, {@link ShortTermProperties},
 * {@link ConsolidationProperties},
 * {@link DedupProperties} - conversational memory</li>
 * <li>{@link UsageProperties}, {@link RecommendProperties},
 * {@link PushProperties} - knowledge usage and recommendation</li>
 * <li>{@link TaskProperties} - worker pools</li>
 * </ul>
 *
 * <p>
 * Thresholds are defaults, every one of them can be tuned per deployment.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "memory")
@Data
public class MemoryProperties {

    private StorageProperties storage = new StorageProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private CompletionProperties completion = new CompletionProperties();
    private HttpProperties http = new HttpProperties();
    private CacheProperties cache = new CacheProperties();
    private RetrievalProperties retrieval = new RetrievalProperties();
    private HybridProperties hybrid = new HybridProperties();
    private RerankProperties rerank = new RerankProperties();
    private QueryExpansionProperties queryExpansion = new QueryExpansionProperties();
    private GraphProperties graph = new GraphProperties();
    private DiaryProperties diary = new DiaryProperties();
    private LongTermProperties longTerm = new LongTermProperties();
    private CoreMemoryProperties core = new CoreMemoryProperties();
    private ShortTermProperties shortTerm = new ShortTermProperties();
    private ConsolidationProperties consolidation = new ConsolidationProperties();
    private DedupProperties dedup = new DedupProperties();
    private UsageProperties usage = new UsageProperties();
    private QualityProperties quality = new QualityProperties();
    private RecommendProperties recommend = new RecommendProperties();
    private PushProperties push = new PushProperties();
    private TaskProperties tasks = new TaskProperties();

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/memory";
        private boolean backupOnWrite = true;
    }

    // ==================== MODEL BACKENDS ====================

    @Data
    public static class EmbeddingProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "text-embedding-3-small";
        private int dimension = 1536;
        private int timeoutSeconds = 10;
    }

    @Data
    public static class CompletionProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.3;
        private int timeoutSeconds = 30;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 2000;
        private long readTimeout = 5000;
        private long writeTimeout = 5000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== CACHE ====================

    @Data
    public static class CacheProperties {
        private int l1MaxSize = 512;
        private int defaultTtlSeconds = 300;
        private int searchTtlSeconds = 120;
        private int statisticsTtlSeconds = 60;
        private RemoteCacheProperties remote = new RemoteCacheProperties();
    }

    @Data
    public static class RemoteCacheProperties {
        private boolean enabled = false;
        private String url = "http://localhost:7379";
        private String keyPrefix = "golemcore-memory";
        private long timeoutMillis = 500;
    }

    // ==================== RETRIEVAL ====================

    /**
     * How vector-index distances are turned into similarities.
     */
    public enum DistanceMetric {
        /** Distances in [0, 1], similarity = 1 - distance. */
        BOUNDED,
        /** Unbounded distances (raw L2), similarity = 1 / (1 + distance). */
        UNBOUNDED
    }

    @Data
    public static class RetrievalProperties {
        private int defaultK = 3;
        private long perSourceTimeoutMillis = 1500;
        private int breakerThreshold = 3;
        private long breakerCooldownMillis = 3000;
        private int cacheMaxSize = 128;
        private int cacheTtlSeconds = 60;
        private int poolSize = 8;
        private DistanceMetric distanceMetric = DistanceMetric.BOUNDED;
    }

    @Data
    public static class HybridProperties {
        private double alpha = 0.6;
        private double threshold = 0.0;
        private int vectorFetchMultiplier = 3;
        private int bm25LimitMultiplier = 10;
        private double bm25K1 = 1.5;
        private double bm25B = 0.75;
    }

    @Data
    public static class RerankProperties {
        private double baseWeight = 0.3;
        private double recencyWeight = 0.15;
        private double importanceWeight = 0.2;
        private double usageWeight = 0.15;
        private double contextWeight = 0.2;
        private double recencyDecayDays = 365;
    }

    @Data
    public static class QueryExpansionProperties {
        private boolean enabled = false;
        private int maxExpansions = 3;
    }

    // ==================== KNOWLEDGE GRAPH ====================

    @Data
    public static class GraphProperties {
        private boolean autosave = true;
        private int anchorsPerCategory = 3;
        private double categoryConfidence = 0.6;
        private int keywordTopK = 5;
        private int maxIdsPerKeyword = 50;
        private int maxRuleRelations = 5000;
        private double minKeywordConfidence = 0.2;
        private int maxNodesVisited = 500;
        private int llmBatchSize = 10;
    }

    // ==================== CONVERSATIONAL MEMORY ====================

    @Data
    public static class DiaryProperties {
        private double importanceThreshold = 0.7;
        private double happyImportanceThreshold = 0.6;
        private double negativeImportanceThreshold = 0.4;
        private int longContentLength = 50;
        private int dailyHappyCap = 3;
        private int minContentLength = 5;
        private int minIntervalSeconds = 60;
        private int dailyEntryCap = 20;
        private int dedupWindow = 50;
        private double fuzzyThreshold = 0.9;
        private int maxAgeDays = 365;
        private int maxItems = 1000;
        private double protectImportanceAbove = 0.8;
    }

    @Data
    public static class LongTermProperties {
        private int batchSize = 10;
        private int batchIntervalSeconds = 30;
        private double minSimilarity = 0.3;
        private int noDecayDays = 30;
        private double characterWeight = 0.0;
        private int maxFetch = 20;
    }

    @Data
    public static class CoreMemoryProperties {
        private double minSimilarity = 0.3;
    }

    @Data
    public static class ShortTermProperties {
        private int windowPairs = 10;
    }

    @Data
    public static class ConsolidationProperties {
        private double skipBelow = 0.3;
        private double promoteThreshold = 0.6;
        private int autoEvery = 10;
        private boolean autoEnabled = true;
        private String userLabel = "User";
        private String assistantLabel = "Assistant";
    }

    @Data
    public static class DedupProperties {
        private double similarityThreshold = 0.85;
        private int maxSeenHashes = 50000;
    }

    // ==================== KNOWLEDGE USAGE ====================

    @Data
    public static class UsageProperties {
        private int flushThreshold = 20;
        private int flushIntervalSeconds = 30;
    }

    @Data
    public static class QualityProperties {
        private boolean assessOnWrite = true;
        private boolean conflictDetection = true;
        private double lowScoreWarning = 0.4;
    }

    @Data
    public static class RecommendProperties {
        private double minScore = 0.3;
        private int historyLimit = 1000;
    }

    @Data
    public static class PushProperties {
        private int cooldownSeconds = 300;
        private double minRelevance = 0.3;
        private double minQuality = 0.5;
    }

    @Data
    public static class TaskProperties {
        private int workers = 2;
        private int queueCapacity = 100;
        private int flushTickSeconds = 5;
    }
}
