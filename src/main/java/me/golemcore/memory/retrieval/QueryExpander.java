package me.golemcore.memory.retrieval;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.llm.LlmJsonClient;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * LLM-based query expansion. The original query always comes first; at most
 * {@code maxExpansions} alternatives follow. Without an LLM, or when its
 * answer is unusable, the result is just the original query.
 */
@Slf4j
public class QueryExpander {

    private static final String PROMPT = """
            Rewrite the search query below into up to %d alternative queries that use synonyms, \
            related terms or a different phrasing, so that more relevant documents can be found.
            Answer with JSON only: {"expanded_queries": ["...", "..."]}

            Query: %s
            """;

    private final LlmJsonClient llm;

    public QueryExpander(LlmJsonClient llm) {
        this.llm = llm;
    }

    public Expansion expand(String query, int maxExpansions) {
        if (query == null || query.isBlank() || maxExpansions <= 0) {
            return Expansion.original(query);
        }
        Optional<JsonNode> answer = llm.completeJson("query expansion", PROMPT.formatted(maxExpansions, query));
        if (answer.isEmpty()) {
            return Expansion.original(query);
        }
        JsonNode expanded = answer.get().path("expanded_queries");
        if (!expanded.isArray()) {
            log.debug("[QueryExpander] Answer without expanded_queries, keeping original query");
            return Expansion.original(query);
        }

        Set<String> queries = new LinkedHashSet<>();
        queries.add(query);
        for (JsonNode node : expanded) {
            String text = node.asText("").trim();
            if (!text.isEmpty()) {
                queries.add(text);
            }
            if (queries.size() >= maxExpansions + 1) {
                break;
            }
        }
        return new Expansion(List.copyOf(queries), queries.size() > 1);
    }

    /**
     * @param expanded
     *            whether the LLM contributed any alternative
     */
    public record Expansion(List<String> queries, boolean expanded) {

        static Expansion original(String query) {
            return new Expansion(query == null ? List.of() : List.of(query), false);
        }
    }
}
