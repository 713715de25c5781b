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

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Knowledge ("lore") entry owned by the knowledge base. Ids are unique per
 * owner; keywords are a set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class KnowledgeEntry {

    private String id;
    private String title;
    private String content;
    private String category;

    @Builder.Default
    private Set<String> keywords = new LinkedHashSet<>();

    private String source;
    private Instant timestamp;
    private int updateCount;
    private int usageCount;
    private int positiveFeedback;
    private int negativeFeedback;
    private Double qualityScore;

    @Builder.Default
    private List<String> qualityIssues = new ArrayList<>();

    private Instant lastUsed;

    public KnowledgeEntry copy() {
        return toBuilder()
                .keywords(new LinkedHashSet<>(keywords != null ? keywords : Set.of()))
                .qualityIssues(new ArrayList<>(qualityIssues != null ? qualityIssues : List.of()))
                .build();
    }
}
