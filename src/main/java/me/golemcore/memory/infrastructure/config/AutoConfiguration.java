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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.port.outbound.CompletionPort;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for shared infrastructure beans of the memory core.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock} and JSON {@link ObjectMapper}</li>
 * <li>Creates the bounded worker pool used for blocking retrieval calls</li>
 * <li>Logs which model backends are available at startup</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final MemoryProperties properties;
    private final EmbeddingPort embeddingPort;
    private final CompletionPort completionPort;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Worker pool for blocking retrieval calls. Bounded on both threads and
     * queue; when saturated a submission is rejected and the retriever treats
     * that source as unavailable for the round.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService retrievalExecutor() {
        int poolSize = Math.max(1, properties.getRetrieval().getPoolSize());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "memory-retrieval-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(poolSize, poolSize, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(poolSize * 16), threadFactory,
                new ThreadPoolExecutor.AbortPolicy());
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Memory starting...");
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("Embedding backend: {} ({})", embeddingPort.isAvailable() ? "available" : "unavailable",
                properties.getEmbedding().getModel());
        log.info("Completion backend: {} ({})", completionPort.isAvailable() ? "available" : "unavailable",
                properties.getCompletion().getModel());
        log.info("Remote cache: {}", properties.getCache().getRemote().isEnabled() ? "enabled" : "disabled");
    }
}
