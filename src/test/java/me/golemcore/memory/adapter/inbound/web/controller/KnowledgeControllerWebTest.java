package me.golemcore.memory.adapter.inbound.web.controller;

import me.golemcore.memory.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.memory.adapter.inbound.web.dto.FeedbackRequest;
import me.golemcore.memory.adapter.inbound.web.dto.RecommendRequest;
import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.domain.service.MemoryCoreService;
import me.golemcore.memory.knowledge.ImportReport;
import me.golemcore.memory.knowledge.KnowledgeHit;
import me.golemcore.memory.recommend.RecommendationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KnowledgeControllerWebTest {

    private MemoryCoreService memoryCoreService;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        memoryCoreService = mock(MemoryCoreService.class);
        webTestClient = WebTestClient.bindToController(new KnowledgeController(memoryCoreService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldReturnSearchHits() {
        KnowledgeEntry entry = KnowledgeEntry.builder().id("lore_1").title("Green tea").content("Steep.").build();
        when(memoryCoreService.searchKnowledge("alice", "tea", 2, null))
                .thenReturn(List.of(new KnowledgeHit(entry, 0.9, 0.7, null)));

        webTestClient.get()
                .uri("/api/memory/alice/knowledge/search?query=tea&k=2")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].entry.id").isEqualTo("lore_1")
                .jsonPath("$[0].score").isEqualTo(0.9)
                .jsonPath("$[0].finalScore").isEqualTo(0.7);
    }

    @Test
    void shouldMapInvalidArgumentToBadRequest() {
        when(memoryCoreService.searchKnowledge("alice", "tea", -1, null))
                .thenThrow(new IllegalArgumentException("k must not be negative: -1"));

        webTestClient.get()
                .uri("/api/memory/alice/knowledge/search?query=tea&k=-1")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400)
                .jsonPath("$.message").isEqualTo("k must not be negative: -1");
    }

    @Test
    void shouldCreateEntry() {
        when(memoryCoreService.addKnowledge(eq("alice"), any(KnowledgeEntry.class))).thenReturn("lore_1");

        webTestClient.post()
                .uri("/api/memory/alice/knowledge")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("title", "Green tea", "content", "Steep at eighty degrees."))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isEqualTo("lore_1");
    }

    @Test
    void shouldReturnNotFoundForMissingEntry() {
        when(memoryCoreService.getKnowledge("alice", "lore_missing")).thenReturn(Optional.empty());

        webTestClient.get()
                .uri("/api/memory/alice/knowledge/lore_missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.status").isEqualTo(404)
                .jsonPath("$.message").isEqualTo("Knowledge entry not found: lore_missing");
    }

    @Test
    void shouldDeleteEntry() {
        when(memoryCoreService.deleteKnowledge("alice", "lore_1")).thenReturn(true);
        when(memoryCoreService.deleteKnowledge("alice", "lore_2")).thenReturn(false);

        webTestClient.delete().uri("/api/memory/alice/knowledge/lore_1").exchange()
                .expectStatus().isNoContent();
        webTestClient.delete().uri("/api/memory/alice/knowledge/lore_2").exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void shouldMapFailedWriteToConflict() {
        when(memoryCoreService.updateKnowledge(eq("alice"), eq("lore_1"), any(KnowledgeEntry.class)))
                .thenThrow(new IllegalStateException("Failed to write alice/lore_books.json"));

        webTestClient.put()
                .uri("/api/memory/alice/knowledge/lore_1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("content", "Steep at seventy degrees."))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.message").isEqualTo("Failed to write alice/lore_books.json");
    }

    @Test
    void shouldUseDefaultUserForFeedback() {
        when(memoryCoreService.recordFeedback("alice", "default", "lore_1", true)).thenReturn(true);

        webTestClient.post()
                .uri("/api/memory/alice/knowledge/lore_1/feedback")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new FeedbackRequest(null, true))
                .exchange()
                .expectStatus().isNoContent();

        verify(memoryCoreService).recordFeedback("alice", "default", "lore_1", true);
    }

    @Test
    void shouldImportWithOverwriteFlag() {
        when(memoryCoreService.importKnowledge(eq("alice"), anyList(), anyBoolean()))
                .thenReturn(new ImportReport(1, 0, 0));

        webTestClient.post()
                .uri("/api/memory/alice/knowledge/import?overwrite=true")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(List.of(Map.of("id", "lore_1", "title", "Green tea", "content", "Steep.")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.imported").isEqualTo(1);

        verify(memoryCoreService).importKnowledge(eq("alice"), anyList(), eq(true));
    }

    @Test
    void shouldBuildRecommendationContextFromRequest() {
        RecommendRequest request = new RecommendRequest();
        request.setUserId("bob");
        request.setTopic("food");
        request.setKeywords(List.of("tea"));

        RecommendationContext context = KnowledgeController.toContext(request);

        assertEquals("bob", context.getUserId());
        assertEquals("food", context.getTopic());
        assertEquals(List.of("tea"), context.getKeywords());

        request.setUserId(" ");
        assertEquals("default", KnowledgeController.toContext(request).getUserId());
    }
}
