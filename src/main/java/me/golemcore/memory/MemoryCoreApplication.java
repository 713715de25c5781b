package me.golemcore.memory;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Memory.
 *
 * <p>
 * GolemCore Memory is the memory-and-knowledge retrieval core of a
 * conversational companion agent. It decides what the agent remembers, finds
 * the most relevant facts for a new turn, and keeps a growing knowledge base
 * coherent over time.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Conversational Memory</b> - short-term window, long-term vector store,
 * core facts and a filtered diary with importance-based consolidation</li>
 * <li><b>Hybrid Retrieval</b> - vector + BM25 fusion with optional LLM query
 * expansion and multi-dimensional reranking</li>
 * <li><b>Knowledge Graph</b> - typed, confidence-weighted relations with rule
 * and LLM extraction and bounded traversal</li>
 * <li><b>Caching</b> - in-process LRU/TTL tier with an optional remote tier and
 * buffered usage counters</li>
 * <li><b>Concurrent Retrieval</b> - fan-out over memory sources with per-source
 * timeouts and circuit breakers</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → MemoryController (REST)
 * Domain Layer       → MemoryCoreService, MemoryEngineRegistry, owner contexts
 * Infrastructure     → Embedding/Completion/Storage/Vector/Cache adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code memory.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MemoryCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryCoreApplication.class, args);
    }

}
