package me.golemcore.memory.quality;

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
import me.golemcore.memory.llm.LlmJsonClient;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Finds existing entries that contradict a new one. Only entries of the same
 * category sharing at least one keyword are compared, and each comparison is
 * an LLM verdict; without an LLM nothing is reported.
 */
@Slf4j
public class ConflictDetector {

    private static final String CONTRADICTION = "contradiction";
    private static final double CONFIDENCE = 0.8;

    private static final String PROMPT = """
            You detect contradictions between knowledge entries.
            Return true only if both entries describe the same thing and their statements contradict each other.
            Entries about different things, or where one only adds detail to the other, are not contradictions.

            Entry 1: %s
            %s

            Entry 2: %s
            %s

            Respond with JSON only: {"has_contradiction": true|false, "reason": "..."}
            """;

    private final LlmJsonClient llm;
    private final boolean enabled;

    public ConflictDetector(LlmJsonClient llm, boolean enabled) {
        this.llm = llm;
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled && llm.isAvailable();
    }

    public List<Conflict> detect(KnowledgeEntry entry, Collection<KnowledgeEntry> existing) {
        if (!isEnabled() || existing == null || existing.isEmpty()) {
            return List.of();
        }
        List<Conflict> conflicts = new ArrayList<>();
        for (KnowledgeEntry other : existing) {
            if (Objects.equals(other.getId(), entry.getId()) || !isSameTopic(entry, other)) {
                continue;
            }
            contradiction(entry, other).ifPresent(reason -> conflicts.add(
                    new Conflict(other.getId(), other.getTitle(), CONTRADICTION, CONFIDENCE, reason)));
        }
        return conflicts;
    }

    static boolean isSameTopic(KnowledgeEntry first, KnowledgeEntry second) {
        if (!Objects.equals(first.getCategory(), second.getCategory())) {
            return false;
        }
        if (first.getKeywords() == null || second.getKeywords() == null) {
            return false;
        }
        Set<String> common = new HashSet<>(first.getKeywords());
        common.retainAll(second.getKeywords());
        return !common.isEmpty();
    }

    private Optional<String> contradiction(KnowledgeEntry first, KnowledgeEntry second) {
        String prompt = PROMPT.formatted(nullToEmpty(first.getTitle()), nullToEmpty(first.getContent()),
                nullToEmpty(second.getTitle()), nullToEmpty(second.getContent()));
        Optional<JsonNode> verdict = llm.completeJson("conflict detection", prompt);
        if (verdict.isEmpty() || !verdict.get().path("has_contradiction").asBoolean(false)) {
            return Optional.empty();
        }
        String reason = verdict.get().path("reason").asText("");
        log.debug("[ConflictDetector] {} contradicts {}: {}", first.getId(), second.getId(), reason);
        return Optional.of(reason);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
