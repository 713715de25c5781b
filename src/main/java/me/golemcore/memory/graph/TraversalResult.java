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

import me.golemcore.memory.domain.model.RelatedKnowledge;

import java.util.List;

/**
 * Related-node search result.
 *
 * @param visitedNodes
 *            number of nodes visited, start node included
 * @param truncated
 *            whether the visit budget stopped the search early
 */
public record TraversalResult(List<RelatedKnowledge> related, int visitedNodes, boolean truncated) {
}
