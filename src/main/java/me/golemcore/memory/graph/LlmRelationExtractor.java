package me.golemcore.memory.graph;

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
import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.domain.model.RelationType;
import me.golemcore.memory.llm.LlmJsonClient;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * LLM relation extraction over batches of knowledge entries.
 *
 * <p>
 * The model sees id, title, category and the first 200 characters of each
 * entry and answers with a JSON list of relations. Relations that reference
 * unknown ids or types, or point a node at itself, are dropped; confidences
 * are clamped to [0, 1]. A failed batch contributes nothing.
 */
@Slf4j
public class LlmRelationExtractor {

    private static final int CONTENT_PREVIEW = 200;

    private static final String PROMPT = """
            You are a knowledge graph expert. Extract relations between the knowledge entries below.

            Entries:
            %s

            Relation types: related_to, part_of, causes, precedes, similar_to, opposite_to, \
            example_of, defined_by, located_in, owned_by.

            Answer with JSON only:
            {"relations": [{"source_id": "...", "target_id": "...", "relation_type": "...", \
            "confidence": 0.0, "description": "..."}]}
            """;

    private final LlmJsonClient llm;
    private final int batchSize;

    public LlmRelationExtractor(LlmJsonClient llm, int batchSize) {
        this.llm = llm;
        this.batchSize = Math.max(2, batchSize);
    }

    public boolean isAvailable() {
        return llm.isAvailable();
    }

    public List<ProposedRelation> extract(List<KnowledgeEntry> entries) {
        if (entries.size() < 2 || !isAvailable()) {
            return List.of();
        }
        List<ProposedRelation> relations = new ArrayList<>();
        for (int start = 0; start < entries.size(); start += batchSize) {
            List<KnowledgeEntry> batch = entries.subList(start, Math.min(entries.size(), start + batchSize));
            if (batch.size() > 1) {
                relations.addAll(extractBatch(batch));
            }
        }
        log.info("[KnowledgeGraph] LLM extracted {} relations from {} entries", relations.size(), entries.size());
        return relations;
    }

    private List<ProposedRelation> extractBatch(List<KnowledgeEntry> batch) {
        StringBuilder described = new StringBuilder();
        Set<String> ids = new HashSet<>();
        for (KnowledgeEntry entry : batch) {
            ids.add(entry.getId());
            String content = entry.getContent() != null ? entry.getContent() : "";
            described.append("ID: ").append(entry.getId()).append('\n')
                    .append("Title: ").append(entry.getTitle()).append('\n')
                    .append("Category: ").append(entry.getCategory()).append('\n')
                    .append("Content: ").append(content, 0, Math.min(CONTENT_PREVIEW, content.length()))
                    .append("\n\n");
        }

        Optional<JsonNode> answer = llm.completeJson("relation extraction", PROMPT.formatted(described));
        if (answer.isEmpty()) {
            return List.of();
        }
        JsonNode items = answer.get().isArray() ? answer.get() : answer.get().path("relations");
        List<ProposedRelation> relations = new ArrayList<>();
        for (JsonNode item : items) {
            String source = item.path("source_id").asText("");
            String target = item.path("target_id").asText("");
            Optional<RelationType> type = RelationType.parse(item.path("relation_type").asText(null));
            if (!ids.contains(source) || !ids.contains(target) || source.equals(target) || type.isEmpty()) {
                continue;
            }
            double confidence = Math.max(0.0, Math.min(1.0, item.path("confidence").asDouble(0.8)));
            String description = item.hasNonNull("description") ? item.get("description").asText() : null;
            relations.add(new ProposedRelation(source, target, type.get(), confidence, description));
        }
        return relations;
    }
}
