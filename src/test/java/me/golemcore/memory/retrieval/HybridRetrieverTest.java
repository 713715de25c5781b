package me.golemcore.memory.retrieval;

import me.golemcore.memory.adapter.outbound.vector.InMemoryVectorIndexAdapter;
import me.golemcore.memory.domain.model.RetrievalCandidate;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.testsupport.HashingEmbeddingPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HybridRetrieverTest {

    private HashingEmbeddingPort embeddingPort;
    private EmbeddingStore embeddingStore;
    private List<RetrievalCandidate> corpus;
    private AtomicInteger corpusReads;
    private HybridRetriever retriever;

    @BeforeEach
    void setUp() {
        embeddingPort = new HashingEmbeddingPort();
        embeddingStore = new EmbeddingStore(embeddingPort, new InMemoryVectorIndexAdapter(), "test",
                MemoryProperties.DistanceMetric.BOUNDED);
        corpus = new ArrayList<>();
        corpusReads = new AtomicInteger();
        retriever = new HybridRetriever(embeddingStore, () -> {
            corpusReads.incrementAndGet();
            return List.copyOf(corpus);
        }, new MemoryProperties.HybridProperties());

        add("d1", "hello world", "greeting");
        add("d2", "something else", "misc");
        add("d3", "another doc", "misc");
    }

    @Test
    void shouldRankLexicalAndVectorMatchFirst() {
        List<RetrievalCandidate> results = retriever.search("hello", 5, null, 0.6, 0.0);

        assertFalse(results.isEmpty());
        RetrievalCandidate top = results.get(0);
        assertEquals("d1", top.getId());
        assertTrue(top.getVectorScore() > 0.0);
        assertTrue(top.getBm25Score() > 0.0);
    }

    @Test
    void shouldReturnNothingForQueryWithoutAnySignal() {
        assertTrue(retriever.search("qwertyuiop", 5, null, 0.6, 0.0).isEmpty());
    }

    @Test
    void shouldReturnLexicalHitsWhenEmbeddingsAreUnavailable() {
        embeddingPort.setAvailable(false);

        List<RetrievalCandidate> results = retriever.search("another", 5, null, 0.6, 0.0);

        assertEquals(List.of("d3"), results.stream().map(RetrievalCandidate::getId).toList());
        assertEquals(0.0, results.get(0).getVectorScore());
    }

    @Test
    void shouldApplyCategoryFilter() {
        List<RetrievalCandidate> results = retriever.search("hello doc", 5, "misc", 0.6, 0.0);

        assertEquals(List.of("d3"), results.stream().map(RetrievalCandidate::getId).toList());
    }

    @Test
    void shouldDropResultsBelowThreshold() {
        assertTrue(retriever.search("hello", 5, null, 0.6, 1.5).isEmpty());
    }

    @Test
    void shouldBuildLexicalIndexOnceUntilInvalidated() {
        retriever.search("hello", 5, null);
        retriever.search("world", 5, null);
        assertEquals(1, corpusReads.get());

        add("d4", "hello again", "greeting");
        retriever.invalidate();
        List<RetrievalCandidate> results = retriever.search("again", 5, null);

        assertEquals(2, corpusReads.get());
        assertEquals("d4", results.get(0).getId());
    }

    @Test
    void shouldKeepFusionMonotonicInVectorScoreForEqualLexicalScore() {
        EmbeddingStore vectors = mock(EmbeddingStore.class);
        when(vectors.search(anyString(), anyInt())).thenReturn(List.of(
                new EmbeddingStore.VectorHit("b", 0.4, Map.of()),
                new EmbeddingStore.VectorHit("a", 0.9, Map.of())));
        List<RetrievalCandidate> documents = List.of(
                RetrievalCandidate.builder().id("a").content("alpha x1").build(),
                RetrievalCandidate.builder().id("b").content("alpha x2").build(),
                RetrievalCandidate.builder().id("c").content("zzz").build());
        HybridRetriever fused = new HybridRetriever(vectors, () -> documents,
                new MemoryProperties.HybridProperties());

        for (double alpha : new double[] { 0.1, 0.5, 0.9, 1.0 }) {
            List<RetrievalCandidate> results = fused.search("alpha", 5, null, alpha, 0.0);

            RetrievalCandidate a = find(results, "a");
            RetrievalCandidate b = find(results, "b");
            assertEquals(a.getBm25Score(), b.getBm25Score(), 1e-9);
            assertTrue(a.getScore() >= b.getScore(), "alpha=" + alpha);
            assertEquals("a", results.get(0).getId());
        }
    }

    @Test
    void shouldNormalizeEqualScoresToZero() {
        Map<String, Double> raw = new LinkedHashMap<>();
        raw.put("a", 2.0);
        raw.put("b", 2.0);

        Map<String, Double> normalized = HybridRetriever.normalize(raw, 2);

        assertEquals(0.0, normalized.get("a"));
        assertEquals(0.0, normalized.get("b"));
    }

    @Test
    void shouldTreatAbsentDocumentsAsZeroWhenNormalizing() {
        Map<String, Double> normalized = HybridRetriever.normalize(Map.of("a", 2.0), 3);

        assertEquals(1.0, normalized.get("a"));
    }

    private static RetrievalCandidate find(List<RetrievalCandidate> results, String id) {
        return results.stream().filter(candidate -> id.equals(candidate.getId())).findFirst().orElseThrow();
    }

    private void add(String id, String content, String category) {
        corpus.add(RetrievalCandidate.builder().id(id).content(content).category(category).build());
        embeddingStore.index(List.of(new EmbeddingStore.VectorDocument(id, content, Map.of("category", category))));
    }
}
