package me.golemcore.memory.knowledge;

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

import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.domain.model.ScoreBreakdown;

/**
 * Knowledge search result.
 *
 * @param score
 *            retrieval score (similarity or fused hybrid score)
 * @param finalScore
 *            reranked score, null when reranking was not requested
 */
public record KnowledgeHit(KnowledgeEntry entry, double score, Double finalScore, ScoreBreakdown breakdown) {

    public double rankingScore() {
        return finalScore != null ? finalScore : score;
    }
}
