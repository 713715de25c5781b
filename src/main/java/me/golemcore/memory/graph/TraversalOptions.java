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

/**
 * Bounds of a related-node search.
 *
 * @param maxDepth
 *            maximum hop count; 0 yields no results
 * @param minConfidence
 *            edges below this confidence are not followed
 * @param includeIncoming
 *            also follow edges pointing at the current node
 * @param maxResults
 *            result size cap
 * @param maxNodesVisited
 *            hard cap on visited nodes, including the start node
 */
public record TraversalOptions(int maxDepth, double minConfidence, boolean includeIncoming, int maxResults,
        int maxNodesVisited) {

    public static TraversalOptions defaults() {
        return new TraversalOptions(2, 0.5, false, 50, 500);
    }

    public TraversalOptions withMaxDepth(int depth) {
        return new TraversalOptions(depth, minConfidence, includeIncoming, maxResults, maxNodesVisited);
    }

    public TraversalOptions withMinConfidence(double confidence) {
        return new TraversalOptions(maxDepth, confidence, includeIncoming, maxResults, maxNodesVisited);
    }

    public TraversalOptions withIncoming(boolean incoming) {
        return new TraversalOptions(maxDepth, minConfidence, incoming, maxResults, maxNodesVisited);
    }

    public TraversalOptions withMaxResults(int results) {
        return new TraversalOptions(maxDepth, minConfidence, includeIncoming, results, maxNodesVisited);
    }

    public TraversalOptions withMaxNodesVisited(int visited) {
        return new TraversalOptions(maxDepth, minConfidence, includeIncoming, maxResults, visited);
    }
}
