package me.golemcore.memory.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Document flowing through hybrid retrieval and reranking.
 *
 * <p>
 * {@code score} is the fused retrieval score; {@code finalScore} is set by the
 * reranker. {@code vectorRank} is the position in the vector result list, or
 * {@link Integer#MAX_VALUE} for lexical-only hits.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class RetrievalCandidate {

    private String id;
    private String content;
    private String category;

    @Builder.Default
    private Set<String> keywords = new LinkedHashSet<>();

    private Instant timestamp;
    private Double importance;
    private int usageCount;

    private double vectorScore;
    private double bm25Score;
    private double score;

    @Builder.Default
    private int vectorRank = Integer.MAX_VALUE;

    private Double finalScore;
    private ScoreBreakdown breakdown;
}
