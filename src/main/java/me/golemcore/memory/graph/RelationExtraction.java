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

import me.golemcore.memory.domain.model.RelationSource;

import java.util.List;

/**
 * Outcome of relation extraction, tagged with the path that produced it.
 */
public record RelationExtraction(List<ProposedRelation> relations, RelationSource source) {

    public static RelationExtraction llm(List<ProposedRelation> relations) {
        return new RelationExtraction(List.copyOf(relations), RelationSource.LLM);
    }

    public static RelationExtraction rules(List<ProposedRelation> relations) {
        return new RelationExtraction(List.copyOf(relations), RelationSource.RULE);
    }

    public boolean isEmpty() {
        return relations.isEmpty();
    }
}
