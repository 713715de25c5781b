package me.golemcore.memory.recommend;

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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Conversation state used to pick knowledge for a user.
 */
@Value
@Builder(toBuilder = true)
public class RecommendationContext {

    String query;
    String topic;

    @Builder.Default
    List<String> keywords = List.of();

    @Builder.Default
    List<String> recentTopics = List.of();

    @Builder.Default
    String userId = "default";

    String userMessage;
    String lastUsedKnowledgeId;

    public static RecommendationContext ofQuery(String query) {
        return RecommendationContext.builder().query(query).build();
    }
}
