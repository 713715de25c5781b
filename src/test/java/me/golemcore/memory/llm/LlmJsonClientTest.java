package me.golemcore.memory.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.port.outbound.CompletionPort;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LlmJsonClientTest {

    @Test
    void shouldExtractFencedJson() {
        String answer = "Sure!\n```json\n{\"a\": 1}\n```\nDone.";

        assertEquals("{\"a\": 1}", LlmJsonClient.extractJson(answer));
    }

    @Test
    void shouldExtractBareObjectSurroundedByProse() {
        assertEquals("{\"a\": [1, 2]}", LlmJsonClient.extractJson("Here: {\"a\": [1, 2]} hope it helps"));
    }

    @Test
    void shouldReturnEmptyOnTimeout() {
        CompletionPort port = mock(CompletionPort.class);
        when(port.isAvailable()).thenReturn(true);
        when(port.complete(anyString())).thenReturn(new CompletableFuture<>());
        LlmJsonClient client = new LlmJsonClient(port, new ObjectMapper(), Duration.ofMillis(50));

        assertTrue(client.completeText("test", "prompt").isEmpty());
    }

    @Test
    void shouldParseJsonAnswer() {
        CompletionPort port = mock(CompletionPort.class);
        when(port.isAvailable()).thenReturn(true);
        when(port.complete(anyString())).thenReturn(CompletableFuture.completedFuture("[{\"x\": \"y\"}]"));
        LlmJsonClient client = new LlmJsonClient(port, new ObjectMapper(), Duration.ofSeconds(1));

        Optional<JsonNode> parsed = client.completeJson("test", "prompt");

        assertTrue(parsed.isPresent());
        assertEquals("y", parsed.get().get(0).get("x").asText());
    }
}
