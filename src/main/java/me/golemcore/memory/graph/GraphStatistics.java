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

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Size and shape of the graph. {@code edgeCount} counts directed edges, so a
 * symmetric relation contributes two.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GraphStatistics(int nodeCount, int edgeCount, double avgDegree, double density,
        Map<String, Integer> relationTypes) {
}
