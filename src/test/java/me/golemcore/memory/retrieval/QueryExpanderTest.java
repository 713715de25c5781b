package me.golemcore.memory.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.llm.LlmJsonClient;
import me.golemcore.memory.port.outbound.CompletionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryExpanderTest {

    private CompletionPort completionPort;
    private QueryExpander expander;

    @BeforeEach
    void setUp() {
        completionPort = mock(CompletionPort.class);
        when(completionPort.isAvailable()).thenReturn(true);
        expander = new QueryExpander(new LlmJsonClient(completionPort, new ObjectMapper(), Duration.ofSeconds(1)));
    }

    @Test
    void shouldPutOriginalQueryFirstAndCapExpansions() {
        when(completionPort.complete(anyString())).thenReturn(CompletableFuture.completedFuture(
                "{\"expanded_queries\": [\"tea ceremony\", \"matcha\", \"green tea\", \"sencha\"]}"));

        QueryExpander.Expansion expansion = expander.expand("tea", 2);

        assertEquals(List.of("tea", "tea ceremony", "matcha"), expansion.queries());
        assertTrue(expansion.expanded());
    }

    @Test
    void shouldFallBackToOriginalOnMalformedAnswer() {
        when(completionPort.complete(anyString())).thenReturn(CompletableFuture.completedFuture("no idea"));

        QueryExpander.Expansion expansion = expander.expand("tea", 3);

        assertEquals(List.of("tea"), expansion.queries());
        assertFalse(expansion.expanded());
    }

    @Test
    void shouldFallBackToOriginalWhenCompletionFails() {
        when(completionPort.complete(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("quota")));

        assertEquals(List.of("tea"), expander.expand("tea", 3).queries());
    }

    @Test
    void shouldSkipModelWhenUnavailable() {
        when(completionPort.isAvailable()).thenReturn(false);

        assertEquals(List.of("tea"), expander.expand("tea", 3).queries());
        verify(completionPort, never()).complete(anyString());
    }
}
