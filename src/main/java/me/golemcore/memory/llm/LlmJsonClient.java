package me.golemcore.memory.llm;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.CompletionPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Thin wrapper over {@link CompletionPort} for LLM-assisted features that
 * expect a JSON answer.
 *
 * <p>
 * Every call returns an {@link Optional}: empty when no backend is
 * configured, the call fails or times out, or the answer holds no parsable
 * JSON. Callers take their rule-based branch on empty; no exception ever
 * reaches them.
 */
@Component
@Slf4j
public class LlmJsonClient {

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*([\\[{].*?[]}])\\s*```",
            Pattern.DOTALL);

    private final CompletionPort completionPort;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    @Autowired
    public LlmJsonClient(CompletionPort completionPort, ObjectMapper objectMapper, MemoryProperties properties) {
        this(completionPort, objectMapper, Duration.ofSeconds(properties.getCompletion().getTimeoutSeconds()));
    }

    public LlmJsonClient(CompletionPort completionPort, ObjectMapper objectMapper, Duration timeout) {
        this.completionPort = completionPort;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    public boolean isAvailable() {
        return completionPort.isAvailable();
    }

    /**
     * Ask the model and parse its answer as JSON.
     *
     * @param purpose
     *            short label for logs
     */
    public Optional<JsonNode> completeJson(String purpose, String prompt) {
        return completeText(purpose, prompt).flatMap(text -> parse(purpose, text));
    }

    /**
     * Ask the model for free text.
     */
    public Optional<String> completeText(String purpose, String prompt) {
        if (!isAvailable()) {
            return Optional.empty();
        }
        try {
            String text = completionPort.complete(prompt).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (text == null || text.isBlank()) {
                log.debug("[LLM] Empty answer for {}", purpose);
                return Optional.empty();
            }
            return Optional.of(text);
        } catch (TimeoutException e) {
            log.warn("[LLM] {} timed out after {} ms", purpose, timeout.toMillis());
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("[LLM] {} failed: {}", purpose, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    Optional<JsonNode> parse(String purpose, String text) {
        try {
            return Optional.ofNullable(objectMapper.readTree(extractJson(text)));
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Unparsable answer for {}: {}", purpose, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    static String extractJson(String response) {
        Matcher fenced = FENCED_JSON.matcher(response);
        if (fenced.find()) {
            return fenced.group(1);
        }
        int objectStart = response.indexOf('{');
        int arrayStart = response.indexOf('[');
        int start = objectStart < 0 ? arrayStart
                : arrayStart < 0 ? objectStart : Math.min(objectStart, arrayStart);
        if (start >= 0) {
            char close = response.charAt(start) == '{' ? '}' : ']';
            int end = response.lastIndexOf(close);
            if (end > start) {
                return response.substring(start, end + 1);
            }
        }
        return response.trim();
    }
}
