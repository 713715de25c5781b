package me.golemcore.memory.adapter.outbound.llm;

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

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.CompletionPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Completion adapter using langchain4j {@link OpenAiChatModel}.
 *
 * <p>
 * Used only for relation extraction, query expansion, conflict checks and
 * diary summaries. Without {@code memory.completion.api-key} the adapter is
 * unavailable and those features take their rule-based paths.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jCompletionAdapter implements CompletionPort {

    private final MemoryProperties properties;

    private volatile ChatModel chatModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        MemoryProperties.CompletionProperties config = properties.getCompletion();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.info("[Completion] API key not configured, LLM-assisted features disabled");
            initialized = true;
            return;
        }

        try {
            OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .temperature(config.getTemperature())
                    .timeout(Duration.ofSeconds(config.getTimeoutSeconds()));
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            chatModel = builder.build();
            log.info("[Completion] Model initialized: {}", config.getModel());
        } catch (RuntimeException e) {
            log.error("[Completion] Failed to initialize chat model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<String> complete(String prompt) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                throw new IllegalStateException("Completion model not available");
            }
            return chatModel.chat(prompt);
        });
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return chatModel != null;
    }
}
