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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.GraphNode;
import me.golemcore.memory.domain.model.RelationType;
import me.golemcore.memory.infrastructure.config.MemoryProperties;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Rule-based relation extraction, used when the LLM is unavailable or
 * returns nothing. Sub-quadratic by construction:
 *
 * <ul>
 * <li><b>Category anchors</b> - the first {@code anchorsPerCategory} nodes of
 * a category are its anchors; every other node of the category links only to
 * them (confidence 0.6)</li>
 * <li><b>Keyword neighbours</b> - each node links to its top-K nodes by
 * keyword overlap ({@code |shared| / max(|a|, |b|)}); posting lists longer
 * than {@code maxIdsPerKeyword} are truncated before matching</li>
 * <li><b>Ceiling</b> - at most {@code maxRuleRelations} relations are
 * returned, highest confidence first</li>
 * </ul>
 *
 * All rule relations are {@link RelationType#RELATED_TO}.
 */
@Slf4j
public class RuleRelationExtractor {

    static final String SAME_CATEGORY = "same category";

    private final MemoryProperties.GraphProperties config;

    public RuleRelationExtractor(MemoryProperties.GraphProperties config) {
        this.config = config;
    }

    /**
     * Relations among all {@code nodes}.
     */
    public List<ProposedRelation> extract(Collection<GraphNode> nodes) {
        Map<PairKey, ProposedRelation> relations = new LinkedHashMap<>();

        Map<String, List<GraphNode>> byCategory = groupByCategory(nodes);
        for (List<GraphNode> members : byCategory.values()) {
            List<GraphNode> anchors = members.subList(0, Math.min(config.getAnchorsPerCategory(), members.size()));
            for (GraphNode member : members) {
                for (GraphNode anchor : anchors) {
                    addCategoryRelation(relations, member, anchor);
                }
            }
        }

        NodeIndex index = index(nodes);
        for (GraphNode node : nodes) {
            for (ProposedRelation relation : keywordNeighbours(node, index)) {
                merge(relations, relation);
            }
        }

        return applyCeiling(new ArrayList<>(relations.values()));
    }

    /**
     * Relations of one node against an indexed graph. Batches share one
     * {@link #index(Collection)}; each call costs
     * {@code O(anchorsPerCategory + |keywords| * maxIdsPerKeyword)},
     * independent of the graph size.
     */
    public List<ProposedRelation> extractFor(GraphNode node, NodeIndex index) {
        Map<PairKey, ProposedRelation> relations = new LinkedHashMap<>();

        if (node.getCategory() != null) {
            int anchors = 0;
            for (GraphNode anchor : index.anchorCandidates(node.getCategory())) {
                if (anchors >= config.getAnchorsPerCategory()) {
                    break;
                }
                if (!anchor.getId().equals(node.getId())) {
                    addCategoryRelation(relations, node, anchor);
                    anchors++;
                }
            }
        }

        for (ProposedRelation relation : keywordNeighbours(node, index)) {
            merge(relations, relation);
        }

        return applyCeiling(new ArrayList<>(relations.values()));
    }

    /**
     * One pass over {@code nodes}: id lookup, truncated keyword postings and
     * the anchor candidates of every category.
     */
    public NodeIndex index(Collection<GraphNode> nodes) {
        Map<String, GraphNode> byId = new HashMap<>();
        Map<String, List<GraphNode>> anchorCandidates = new HashMap<>();
        // one spare candidate so a node can skip itself and still get a full set
        int candidateLimit = config.getAnchorsPerCategory() + 1;
        for (GraphNode node : nodes) {
            byId.put(node.getId(), node);
            if (node.getCategory() != null) {
                List<GraphNode> candidates = anchorCandidates.computeIfAbsent(node.getCategory(),
                        c -> new ArrayList<>());
                if (candidates.size() < candidateLimit) {
                    candidates.add(node);
                }
            }
        }
        return new NodeIndex(byId, keywordPostings(nodes), anchorCandidates);
    }

    private List<ProposedRelation> keywordNeighbours(GraphNode node, NodeIndex index) {
        Set<String> keywords = normalizedKeywords(node);
        if (keywords.isEmpty()) {
            return List.of();
        }

        Map<String, Set<String>> shared = new HashMap<>();
        for (String keyword : keywords) {
            for (String otherId : index.postings().getOrDefault(keyword, List.of())) {
                if (!otherId.equals(node.getId())) {
                    shared.computeIfAbsent(otherId, id -> new TreeSet<>()).add(keyword);
                }
            }
        }

        List<ProposedRelation> neighbours = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : shared.entrySet()) {
            GraphNode other = index.byId().get(entry.getKey());
            if (other == null) {
                continue;
            }
            int denominator = Math.max(keywords.size(), normalizedKeywords(other).size());
            double confidence = (double) entry.getValue().size() / denominator;
            if (confidence < config.getMinKeywordConfidence()) {
                continue;
            }
            neighbours.add(new ProposedRelation(node.getId(), other.getId(), RelationType.RELATED_TO, confidence,
                    "shared keywords: " + String.join(", ", entry.getValue())));
        }

        return neighbours.stream()
                .sorted(Comparator.comparingDouble(ProposedRelation::confidence).reversed()
                        .thenComparing(ProposedRelation::targetId))
                .limit(config.getKeywordTopK())
                .toList();
    }

    private Map<String, List<String>> keywordPostings(Collection<GraphNode> nodes) {
        Map<String, List<String>> postings = new HashMap<>();
        for (GraphNode node : nodes) {
            for (String keyword : normalizedKeywords(node)) {
                postings.computeIfAbsent(keyword, k -> new ArrayList<>()).add(node.getId());
            }
        }
        int limit = config.getMaxIdsPerKeyword();
        int truncated = 0;
        for (Map.Entry<String, List<String>> entry : postings.entrySet()) {
            if (entry.getValue().size() > limit) {
                entry.setValue(new ArrayList<>(entry.getValue().subList(0, limit)));
                truncated++;
            }
        }
        if (truncated > 0) {
            log.debug("[KnowledgeGraph] Truncated {} common keywords to {} ids each", truncated, limit);
        }
        return postings;
    }

    private List<ProposedRelation> applyCeiling(List<ProposedRelation> relations) {
        int ceiling = config.getMaxRuleRelations();
        if (relations.size() <= ceiling) {
            return relations;
        }
        log.warn("[KnowledgeGraph] Rule extraction produced {} relations, keeping the {} most confident",
                relations.size(), ceiling);
        return relations.stream()
                .sorted(Comparator.comparingDouble(ProposedRelation::confidence).reversed())
                .limit(ceiling)
                .toList();
    }

    private void addCategoryRelation(Map<PairKey, ProposedRelation> relations, GraphNode node, GraphNode anchor) {
        if (node.getId().equals(anchor.getId())) {
            return;
        }
        merge(relations, new ProposedRelation(node.getId(), anchor.getId(), RelationType.RELATED_TO,
                config.getCategoryConfidence(), SAME_CATEGORY));
    }

    private static void merge(Map<PairKey, ProposedRelation> relations, ProposedRelation relation) {
        relations.merge(PairKey.of(relation.sourceId(), relation.targetId()), relation,
                (existing, candidate) -> candidate.confidence() > existing.confidence() ? candidate : existing);
    }

    private static Map<String, List<GraphNode>> groupByCategory(Collection<GraphNode> nodes) {
        Map<String, List<GraphNode>> byCategory = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            if (node.getCategory() != null) {
                byCategory.computeIfAbsent(node.getCategory(), c -> new ArrayList<>()).add(node);
            }
        }
        return byCategory;
    }

    private static Set<String> normalizedKeywords(GraphNode node) {
        Set<String> keywords = new HashSet<>();
        if (node.getKeywords() != null) {
            node.getKeywords().stream()
                    .filter(Objects::nonNull)
                    .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
                    .filter(keyword -> !keyword.isEmpty())
                    .forEach(keywords::add);
        }
        return keywords;
    }

    /**
     * Lookup structures shared by every node of one extraction batch.
     */
    public record NodeIndex(Map<String, GraphNode> byId, Map<String, List<String>> postings,
            Map<String, List<GraphNode>> anchorCandidates) {

        List<GraphNode> anchorCandidates(String category) {
            return anchorCandidates.getOrDefault(category, List.of());
        }
    }

    /**
     * Unordered node pair; rule relations are symmetric.
     */
    private record PairKey(String first, String second) {
        static PairKey of(String a, String b) {
            return a.compareTo(b) <= 0 ? new PairKey(a, b) : new PairKey(b, a);
        }
    }
}
