package me.golemcore.memory.adapter.inbound.web.controller;

import me.golemcore.memory.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.memory.conversation.DiaryCandidate;
import me.golemcore.memory.conversation.DiaryDecision;
import me.golemcore.memory.domain.service.MemoryCoreService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryControllerWebTest {

    private MemoryCoreService memoryCoreService;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        memoryCoreService = mock(MemoryCoreService.class);
        webTestClient = WebTestClient.bindToController(new MemoryController(memoryCoreService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldAcceptInteraction() {
        webTestClient.post()
                .uri("/api/memory/alice/interactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("userMessage", "I love green tea", "assistantMessage", "Noted!"))
                .exchange()
                .expectStatus().isAccepted();

        verify(memoryCoreService).addInteraction("alice", "I love green tea", "Noted!", true, null);
    }

    @Test
    void shouldRejectBlankInteraction() {
        webTestClient.post()
                .uri("/api/memory/alice/interactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("userMessage", "", "assistantMessage", "Noted!"))
                .exchange()
                .expectStatus().isBadRequest();

        verify(memoryCoreService, never()).addInteraction(anyString(), anyString(), anyString(), anyBoolean(),
                any());
    }

    @Test
    void shouldReportDiaryDecision() {
        when(memoryCoreService.addDiaryEntry(eq("alice"), any(DiaryCandidate.class)))
                .thenReturn(DiaryDecision.TOO_SOON);

        webTestClient.post()
                .uri("/api/memory/alice/diary")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("content", "Went hiking with Sam today", "importance", 0.5))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.saved").isEqualTo(false)
                .jsonPath("$.decision").isEqualTo("TOO_SOON");
    }

    @Test
    void shouldReturnNoContentWithoutDailySummary() {
        when(memoryCoreService.generateDailySummary("alice", false)).thenReturn(Optional.empty());

        webTestClient.post()
                .uri("/api/memory/alice/diary/summary")
                .exchange()
                .expectStatus().isNoContent();
    }

    @Test
    void shouldSearchMemories() {
        when(memoryCoreService.searchMemories("alice", "tea", 5)).thenReturn(List.of("User likes green tea"));

        webTestClient.get()
                .uri("/api/memory/alice/search?query=tea")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0]").isEqualTo("User likes green tea");
    }

    @Test
    void shouldMapRejectedCoreMemoryToBadRequest() {
        when(memoryCoreService.addCoreMemory(eq("alice"), anyString(), any(), eq(0.8)))
                .thenThrow(new IllegalArgumentException("content must not be blank"));

        webTestClient.post()
                .uri("/api/memory/alice/core")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("content", "User likes green tea"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("content must not be blank");
    }

    @Test
    void shouldMapUnexpectedFailureToServerError() {
        when(memoryCoreService.getStats("alice")).thenThrow(new RuntimeException("boom"));

        webTestClient.get()
                .uri("/api/memory/alice/stats")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Internal server error");
    }
}
