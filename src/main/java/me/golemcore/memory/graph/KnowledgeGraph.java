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
import me.golemcore.memory.domain.model.GraphEdge;
import me.golemcore.memory.domain.model.GraphNode;
import me.golemcore.memory.domain.model.InferredRelation;
import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.domain.model.RelatedKnowledge;
import me.golemcore.memory.domain.model.RelationSource;
import me.golemcore.memory.domain.model.RelationType;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.persistence.JsonDocumentStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Knowledge graph of one owner: nodes mirror knowledge entries, edges are
 * typed, confidence-weighted relations between node ids.
 *
 * <p>
 * Storage is an adjacency map keyed by id (one edge per ordered node pair)
 * plus an incoming index, so deleting a node touches only its own edges.
 * Symmetric relation types are always written as two directed edges. An edge
 * is replaced only by a source of equal or higher priority (see
 * {@link RelationSource#canOverride}).
 *
 * <p>
 * All access goes through one re-entrant lock. Mutations inside
 * {@link #batch(Supplier)} defer the durable write until the outermost batch
 * ends. With {@code autosave} disabled nothing is written until
 * {@link #flush()}.
 */
@Slf4j
public class KnowledgeGraph {

    private static final double TRANSITIVE_DAMPING = 0.8;

    private static final Comparator<RelatedKnowledge> RANKING = Comparator
            .comparingDouble(RelatedKnowledge::confidence).reversed()
            .thenComparingInt(RelatedKnowledge::depth)
            .thenComparing(RelatedKnowledge::id);

    private final JsonDocumentStore<GraphDocument> store;
    private final RuleRelationExtractor ruleExtractor;
    private final LlmRelationExtractor llmExtractor;
    private final MemoryProperties.GraphProperties config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, Map<String, GraphEdge>> outgoing = new HashMap<>();
    private final Map<String, Set<String>> incoming = new HashMap<>();

    private int batchDepth;
    private boolean dirty;

    public KnowledgeGraph(JsonDocumentStore<GraphDocument> store, RuleRelationExtractor ruleExtractor,
            LlmRelationExtractor llmExtractor, MemoryProperties.GraphProperties config, Clock clock) {
        this.store = store;
        this.ruleExtractor = ruleExtractor;
        this.llmExtractor = llmExtractor;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Replace the in-memory graph with the durable one. Edges whose endpoints
     * are missing are dropped.
     */
    public void load() {
        lock.lock();
        try {
            GraphDocument document = store.load();
            nodes.clear();
            outgoing.clear();
            incoming.clear();
            for (GraphNode node : document.getNodes()) {
                if (node != null && node.getId() != null) {
                    nodes.put(node.getId(), node);
                }
            }
            int dropped = 0;
            for (GraphEdge edge : document.getEdges()) {
                if (edge == null || edge.getRelationType() == null || !nodes.containsKey(edge.getSourceId())
                        || !nodes.containsKey(edge.getTargetId())) {
                    dropped++;
                    continue;
                }
                if (edge.getRelationSource() == null) {
                    edge.setRelationSource(RelationSource.UNKNOWN);
                }
                putEdge(edge);
            }
            dirty = false;
            log.info("[KnowledgeGraph] Loaded {} nodes, {} edges{}", nodes.size(), edgeCountUnlocked(),
                    dropped > 0 ? " (" + dropped + " dangling edges dropped)" : "");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run {@code work} as one batch: a single durable write at the end,
     * however many mutations it performs.
     */
    public <T> T batch(Supplier<T> work) {
        lock.lock();
        try {
            batchDepth++;
            try {
                return work.get();
            } finally {
                batchDepth--;
                persistIfNeeded();
            }
        } finally {
            lock.unlock();
        }
    }

    // ==================== NODES ====================

    public void upsertNode(GraphNode node) {
        requireId(node.getId());
        lock.lock();
        try {
            nodes.put(node.getId(), node);
            markDirty();
            persistIfNeeded();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Add or update the node of {@code entry}, optionally recomputing its
     * rule-derived edges.
     */
    public void upsert(KnowledgeEntry entry, boolean refreshRules) {
        batch(() -> {
            upsertNode(GraphNode.of(entry));
            if (refreshRules) {
                refreshRuleRelationsForNode(entry.getId());
            }
            return null;
        });
    }

    public void upsertMany(Collection<KnowledgeEntry> entries, boolean refreshRules) {
        if (entries.isEmpty()) {
            return;
        }
        batch(() -> {
            for (KnowledgeEntry entry : entries) {
                upsertNode(GraphNode.of(entry));
            }
            if (refreshRules) {
                RuleRelationExtractor.NodeIndex index = ruleExtractor.index(nodes.values());
                for (KnowledgeEntry entry : entries) {
                    GraphNode node = nodes.get(entry.getId());
                    if (node != null) {
                        refreshRuleRelations(node, index);
                    }
                }
            }
            return null;
        });
    }

    /**
     * Remove a node with every edge that touches it.
     *
     * @return whether the node existed
     */
    public boolean deleteNode(String id) {
        lock.lock();
        try {
            if (nodes.remove(id) == null) {
                return false;
            }
            Map<String, GraphEdge> out = outgoing.remove(id);
            if (out != null) {
                for (String target : out.keySet()) {
                    Set<String> sources = incoming.get(target);
                    if (sources != null) {
                        sources.remove(id);
                    }
                }
            }
            Set<String> in = incoming.remove(id);
            if (in != null) {
                for (String source : in) {
                    Map<String, GraphEdge> edges = outgoing.get(source);
                    if (edges != null) {
                        edges.remove(id);
                    }
                }
            }
            markDirty();
            persistIfNeeded();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int deleteNodes(Collection<String> ids) {
        return batch(() -> {
            int removed = 0;
            for (String id : ids) {
                if (deleteNode(id)) {
                    removed++;
                }
            }
            return removed;
        });
    }

    // ==================== EDGES ====================

    public boolean addRelation(String sourceId, String targetId, RelationType type, double confidence,
            String description) {
        return addRelation(sourceId, targetId, type, confidence, description, RelationSource.MANUAL);
    }

    /**
     * Priority-checked upsert of a relation. Symmetric types write both
     * directions or neither.
     *
     * @return whether the relation was written
     */
    public boolean addRelation(String sourceId, String targetId, RelationType type, double confidence,
            String description, RelationSource source) {
        requireId(sourceId);
        requireId(targetId);
        if (type == null) {
            throw new IllegalArgumentException("Relation type is required");
        }
        lock.lock();
        try {
            boolean written = applyRelation(sourceId, targetId, type, confidence, description, source);
            if (written) {
                markDirty();
                persistIfNeeded();
            }
            return written;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Commit a relation proposed by {@link #infer(String)}.
     */
    public boolean accept(InferredRelation relation) {
        return addRelation(relation.sourceId(), relation.targetId(), relation.relationType(),
                relation.confidence(), relation.reason(), RelationSource.INFERENCE);
    }

    /**
     * Drop the rule-derived edges of a node and recompute them against the
     * current graph. Edges from higher-priority sources are kept.
     */
    public void refreshRuleRelationsForNode(String id) {
        lock.lock();
        try {
            GraphNode node = nodes.get(id);
            if (node == null) {
                return;
            }
            refreshRuleRelations(node, ruleExtractor.index(nodes.values()));
            markDirty();
            persistIfNeeded();
        } finally {
            lock.unlock();
        }
    }

    private void refreshRuleRelations(GraphNode node, RuleRelationExtractor.NodeIndex index) {
        removeRuleEdges(node.getId());
        for (ProposedRelation relation : ruleExtractor.extractFor(node, index)) {
            applyRelation(relation.sourceId(), relation.targetId(), relation.relationType(),
                    relation.confidence(), relation.description(), RelationSource.RULE);
        }
    }

    /**
     * Populate the graph from knowledge entries with a single durable write.
     * LLM extraction is tried first; rules run when it is disabled,
     * unavailable or yields nothing.
     *
     * @param rebuild
     *            drop the existing graph first
     */
    public RelationExtraction buildGraphFromKnowledge(List<KnowledgeEntry> entries, boolean useLlm,
            boolean rebuild) {
        return batch(() -> {
            if (rebuild) {
                nodes.clear();
                outgoing.clear();
                incoming.clear();
            }
            for (KnowledgeEntry entry : entries) {
                nodes.put(entry.getId(), GraphNode.of(entry));
            }
            RelationExtraction extraction = extractRelations(entries, useLlm);
            int written = 0;
            for (ProposedRelation relation : extraction.relations()) {
                if (applyRelation(relation.sourceId(), relation.targetId(), relation.relationType(),
                        relation.confidence(), relation.description(), extraction.source())) {
                    written++;
                }
            }
            markDirty();
            log.info("[KnowledgeGraph] Built graph from {} entries: {} {} relations written",
                    entries.size(), written, extraction.source().getValue());
            return extraction;
        });
    }

    /**
     * Relations among {@code entries}, from the LLM when it answers with at
     * least one relation, otherwise from rules.
     */
    public RelationExtraction extractRelations(List<KnowledgeEntry> entries, boolean useLlm) {
        if (useLlm) {
            List<ProposedRelation> fromLlm = llmExtractor.extract(entries);
            if (!fromLlm.isEmpty()) {
                return RelationExtraction.llm(fromLlm);
            }
            log.debug("[KnowledgeGraph] LLM extraction returned nothing, falling back to rules");
        }
        List<GraphNode> entryNodes = entries.stream().map(GraphNode::of).toList();
        return RelationExtraction.rules(ruleExtractor.extract(entryNodes));
    }

    // ==================== QUERIES ====================

    public List<RelatedKnowledge> findRelated(String id, int maxDepth, double minConfidence) {
        return traverse(id, TraversalOptions.defaults()
                .withMaxDepth(maxDepth)
                .withMinConfidence(minConfidence)
                .withMaxNodesVisited(config.getMaxNodesVisited())).related();
    }

    public List<RelatedKnowledge> findRelated(String id, TraversalOptions options) {
        return traverse(id, options).related();
    }

    /**
     * Bounded breadth-first search from {@code id}. Every visited node,
     * including the start node, counts against
     * {@link TraversalOptions#maxNodesVisited()}; hitting the budget stops the
     * search and returns what was found so far. Each node appears once, with
     * its most confident (then shallowest) edge.
     */
    public TraversalResult traverse(String id, TraversalOptions options) {
        lock.lock();
        try {
            if (options.maxDepth() <= 0 || options.maxResults() <= 0 || !nodes.containsKey(id)) {
                return new TraversalResult(List.of(), 0, false);
            }
            int budget = options.maxNodesVisited() > 0 ? options.maxNodesVisited() : config.getMaxNodesVisited();

            Set<String> visited = new HashSet<>();
            visited.add(id);
            Map<String, RelatedKnowledge> best = new HashMap<>();
            Deque<Hop> queue = new ArrayDeque<>();
            queue.add(new Hop(id, 0));
            boolean truncated = false;

            search: while (!queue.isEmpty()) {
                Hop hop = queue.poll();
                if (hop.depth() >= options.maxDepth()) {
                    continue;
                }
                for (GraphEdge edge : neighbourEdges(hop.nodeId(), options.includeIncoming())) {
                    if (edge.getConfidence() < options.minConfidence()) {
                        continue;
                    }
                    String neighbour = edge.getSourceId().equals(hop.nodeId()) ? edge.getTargetId()
                            : edge.getSourceId();
                    if (neighbour.equals(id)) {
                        continue;
                    }
                    RelatedKnowledge candidate = toRelated(neighbour, edge, hop.depth() + 1);
                    if (visited.contains(neighbour)) {
                        best.computeIfPresent(neighbour,
                                (key, existing) -> isBetter(candidate, existing) ? candidate : existing);
                        continue;
                    }
                    if (visited.size() >= budget) {
                        truncated = true;
                        break search;
                    }
                    visited.add(neighbour);
                    best.put(neighbour, candidate);
                    queue.add(new Hop(neighbour, hop.depth() + 1));
                }
            }

            if (truncated) {
                log.warn("[KnowledgeGraph] Traversal from {} stopped after visiting {} nodes", id, visited.size());
            }
            return new TraversalResult(topK(best.values(), options.maxResults()), visited.size(), truncated);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Shortest path (fewest hops) along outgoing edges with confidence at
     * least {@code minConfidence}, optionally restricted to
     * {@code allowedTypes}.
     *
     * @return node ids from {@code from} to {@code to}, or empty when
     *         unreachable
     */
    public Optional<List<String>> findPath(String from, String to, double minConfidence,
            Set<RelationType> allowedTypes) {
        lock.lock();
        try {
            if (!nodes.containsKey(from) || !nodes.containsKey(to)) {
                return Optional.empty();
            }
            if (from.equals(to)) {
                return Optional.of(List.of(from));
            }
            Map<String, String> parents = new HashMap<>();
            parents.put(from, null);
            Deque<String> queue = new ArrayDeque<>();
            queue.add(from);
            while (!queue.isEmpty()) {
                String current = queue.poll();
                for (GraphEdge edge : outgoing.getOrDefault(current, Map.of()).values()) {
                    if (edge.getConfidence() < minConfidence
                            || (allowedTypes != null && !allowedTypes.isEmpty()
                                    && !allowedTypes.contains(edge.getRelationType()))
                            || parents.containsKey(edge.getTargetId())) {
                        continue;
                    }
                    parents.put(edge.getTargetId(), current);
                    if (edge.getTargetId().equals(to)) {
                        return Optional.of(unwind(parents, to));
                    }
                    queue.add(edge.getTargetId());
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Relations implied by the edges around {@code id}: {@code part_of}
     * transitivity and {@code similar_to} symmetry completion. Nothing is
     * committed; see {@link #accept(InferredRelation)}.
     */
    public List<InferredRelation> infer(String id) {
        lock.lock();
        try {
            Map<String, InferredRelation> proposals = new LinkedHashMap<>();
            Map<String, GraphEdge> out = outgoing.getOrDefault(id, Map.of());

            for (GraphEdge first : out.values()) {
                if (first.getRelationType() != RelationType.PART_OF) {
                    continue;
                }
                for (GraphEdge second : outgoing.getOrDefault(first.getTargetId(), Map.of()).values()) {
                    String target = second.getTargetId();
                    if (second.getRelationType() != RelationType.PART_OF || target.equals(id)
                            || out.containsKey(target)) {
                        continue;
                    }
                    double confidence = Math.min(first.getConfidence(), second.getConfidence()) * TRANSITIVE_DAMPING;
                    proposals.merge(id + "->" + target,
                            new InferredRelation(id, target, RelationType.PART_OF, confidence,
                                    "transitive part_of via " + first.getTargetId()),
                            (a, b) -> a.confidence() >= b.confidence() ? a : b);
                }
            }

            for (GraphEdge edge : out.values()) {
                if (edge.getRelationType() == RelationType.SIMILAR_TO
                        && !hasEdge(edge.getTargetId(), id, RelationType.SIMILAR_TO)) {
                    proposals.putIfAbsent(edge.getTargetId() + "->" + id,
                            new InferredRelation(edge.getTargetId(), id, RelationType.SIMILAR_TO,
                                    edge.getConfidence(), "similar_to is symmetric"));
                }
            }
            for (String source : incoming.getOrDefault(id, Set.of())) {
                GraphEdge edge = outgoing.get(source).get(id);
                if (edge.getRelationType() == RelationType.SIMILAR_TO
                        && !hasEdge(id, source, RelationType.SIMILAR_TO)) {
                    proposals.putIfAbsent(id + "->" + source,
                            new InferredRelation(id, source, RelationType.SIMILAR_TO, edge.getConfidence(),
                                    "similar_to is symmetric"));
                }
            }
            return new ArrayList<>(proposals.values());
        } finally {
            lock.unlock();
        }
    }

    public Optional<GraphEdge> getEdge(String sourceId, String targetId) {
        lock.lock();
        try {
            return Optional.ofNullable(outgoing.getOrDefault(sourceId, Map.of()).get(targetId));
        } finally {
            lock.unlock();
        }
    }

    public Optional<GraphNode> getNode(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(nodes.get(id));
        } finally {
            lock.unlock();
        }
    }

    public boolean containsNode(String id) {
        lock.lock();
        try {
            return nodes.containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    public int nodeCount() {
        lock.lock();
        try {
            return nodes.size();
        } finally {
            lock.unlock();
        }
    }

    public int edgeCount() {
        lock.lock();
        try {
            return edgeCountUnlocked();
        } finally {
            lock.unlock();
        }
    }

    public GraphStatistics statistics() {
        lock.lock();
        try {
            int nodeCount = nodes.size();
            int edgeCount = edgeCountUnlocked();
            Map<String, Integer> relationTypes = new TreeMap<>();
            for (Map<String, GraphEdge> edges : outgoing.values()) {
                for (GraphEdge edge : edges.values()) {
                    relationTypes.merge(edge.getRelationType().getValue(), 1, Integer::sum);
                }
            }
            double avgDegree = nodeCount > 0 ? 2.0 * edgeCount / nodeCount : 0.0;
            double density = nodeCount > 1 ? (double) edgeCount / ((double) nodeCount * (nodeCount - 1)) : 0.0;
            return new GraphStatistics(nodeCount, edgeCount, avgDegree, density, relationTypes);
        } finally {
            lock.unlock();
        }
    }

    public GraphVisualization exportForVisualization() {
        lock.lock();
        try {
            List<GraphVisualization.Node> exportedNodes = nodes.values().stream()
                    .map(node -> new GraphVisualization.Node(node.getId(), node.getTitle(), node.getCategory(),
                            node.getKeywords() != null ? new LinkedHashSet<>(node.getKeywords()) : Set.of()))
                    .toList();
            List<GraphVisualization.Edge> exportedEdges = new ArrayList<>();
            for (Map<String, GraphEdge> edges : outgoing.values()) {
                for (GraphEdge edge : edges.values()) {
                    exportedEdges.add(new GraphVisualization.Edge(edge.getSourceId(), edge.getTargetId(),
                            edge.getRelationType().getValue().replace('_', ' '), edge.getConfidence()));
                }
            }
            return new GraphVisualization(exportedNodes, exportedEdges, statistics());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write pending changes regardless of {@code autosave}.
     */
    public void flush() {
        lock.lock();
        try {
            if (dirty) {
                save();
            }
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            nodes.clear();
            outgoing.clear();
            incoming.clear();
            markDirty();
            persistIfNeeded();
        } finally {
            lock.unlock();
        }
    }

    // ==================== INTERNALS ====================

    private boolean applyRelation(String sourceId, String targetId, RelationType type, double confidence,
            String description, RelationSource source) {
        if (sourceId.equals(targetId) || !nodes.containsKey(sourceId) || !nodes.containsKey(targetId)) {
            log.debug("[KnowledgeGraph] Ignoring relation {} -> {}: unknown node or self loop", sourceId, targetId);
            return false;
        }
        RelationSource effectiveSource = source != null ? source : RelationSource.UNKNOWN;
        GraphEdge existing = outgoing.getOrDefault(sourceId, Map.of()).get(targetId);
        // replacing one half of a symmetric pair with a directed type drops the other half
        boolean breaksPair = !type.isSymmetric() && existing != null && existing.getRelationType().isSymmetric();
        if (!canWrite(sourceId, targetId, effectiveSource)
                || ((type.isSymmetric() || breaksPair) && !canWrite(targetId, sourceId, effectiveSource))) {
            log.debug("[KnowledgeGraph] Keeping higher-priority relation {} -> {}", sourceId, targetId);
            return false;
        }
        double clamped = Math.max(0.0, Math.min(1.0, confidence));
        Instant now = clock.instant();
        writeEdge(sourceId, targetId, type, clamped, description, effectiveSource, now);
        if (type.isSymmetric()) {
            writeEdge(targetId, sourceId, type, clamped, description, effectiveSource, now);
        } else if (breaksPair) {
            GraphEdge reverse = outgoing.getOrDefault(targetId, Map.of()).get(sourceId);
            if (reverse != null && reverse.getRelationType().isSymmetric()) {
                removeEdge(targetId, sourceId);
            }
        }
        return true;
    }

    private boolean canWrite(String sourceId, String targetId, RelationSource source) {
        GraphEdge existing = outgoing.getOrDefault(sourceId, Map.of()).get(targetId);
        return existing == null || source.canOverride(existing.getRelationSource());
    }

    private void writeEdge(String sourceId, String targetId, RelationType type, double confidence,
            String description, RelationSource source, Instant now) {
        GraphEdge existing = outgoing.getOrDefault(sourceId, Map.of()).get(targetId);
        putEdge(GraphEdge.builder()
                .sourceId(sourceId)
                .targetId(targetId)
                .relationType(type)
                .confidence(confidence)
                .description(description)
                .relationSource(source)
                .createdAt(existing != null && existing.getCreatedAt() != null ? existing.getCreatedAt() : now)
                .updatedAt(now)
                .build());
    }

    private void putEdge(GraphEdge edge) {
        outgoing.computeIfAbsent(edge.getSourceId(), id -> new LinkedHashMap<>()).put(edge.getTargetId(), edge);
        incoming.computeIfAbsent(edge.getTargetId(), id -> new LinkedHashSet<>()).add(edge.getSourceId());
    }

    private void removeEdge(String sourceId, String targetId) {
        Map<String, GraphEdge> edges = outgoing.get(sourceId);
        if (edges != null) {
            edges.remove(targetId);
        }
        Set<String> sources = incoming.get(targetId);
        if (sources != null) {
            sources.remove(sourceId);
        }
    }

    private void removeRuleEdges(String id) {
        List<String[]> stale = new ArrayList<>();
        for (GraphEdge edge : outgoing.getOrDefault(id, Map.of()).values()) {
            if (edge.getRelationSource() == RelationSource.RULE) {
                stale.add(new String[] {id, edge.getTargetId()});
            }
        }
        for (String source : incoming.getOrDefault(id, Set.of())) {
            GraphEdge edge = outgoing.get(source).get(id);
            if (edge != null && edge.getRelationSource() == RelationSource.RULE) {
                stale.add(new String[] {source, id});
            }
        }
        stale.forEach(pair -> removeEdge(pair[0], pair[1]));
    }

    private List<GraphEdge> neighbourEdges(String id, boolean includeIncoming) {
        List<GraphEdge> edges = new ArrayList<>(outgoing.getOrDefault(id, Map.of()).values());
        if (includeIncoming) {
            for (String source : incoming.getOrDefault(id, Set.of())) {
                GraphEdge edge = outgoing.get(source).get(id);
                if (edge != null) {
                    edges.add(edge);
                }
            }
        }
        return edges;
    }

    private boolean hasEdge(String sourceId, String targetId, RelationType type) {
        GraphEdge edge = outgoing.getOrDefault(sourceId, Map.of()).get(targetId);
        return edge != null && edge.getRelationType() == type;
    }

    private RelatedKnowledge toRelated(String id, GraphEdge edge, int depth) {
        GraphNode node = nodes.get(id);
        return new RelatedKnowledge(id, node.getTitle(), node.getCategory(), edge.getRelationType(),
                edge.getConfidence(), edge.getDescription(), depth);
    }

    private static boolean isBetter(RelatedKnowledge candidate, RelatedKnowledge existing) {
        if (candidate.confidence() != existing.confidence()) {
            return candidate.confidence() > existing.confidence();
        }
        return candidate.depth() < existing.depth();
    }

    private static List<RelatedKnowledge> topK(Collection<RelatedKnowledge> candidates, int k) {
        PriorityQueue<RelatedKnowledge> heap = new PriorityQueue<>(RANKING.reversed());
        for (RelatedKnowledge candidate : candidates) {
            heap.offer(candidate);
            if (heap.size() > k) {
                heap.poll();
            }
        }
        List<RelatedKnowledge> result = new ArrayList<>(heap);
        result.sort(RANKING);
        return result;
    }

    private static List<String> unwind(Map<String, String> parents, String to) {
        List<String> path = new ArrayList<>();
        for (String current = to; current != null; current = parents.get(current)) {
            path.add(0, current);
        }
        return path;
    }

    private int edgeCountUnlocked() {
        int count = 0;
        for (Map<String, GraphEdge> edges : outgoing.values()) {
            count += edges.size();
        }
        return count;
    }

    private void markDirty() {
        dirty = true;
    }

    private void persistIfNeeded() {
        if (batchDepth == 0 && dirty && config.isAutosave()) {
            save();
        }
    }

    private void save() {
        List<GraphEdge> edges = new ArrayList<>();
        outgoing.values().forEach(map -> edges.addAll(map.values()));
        store.save(new GraphDocument(new ArrayList<>(nodes.values()), edges));
        dirty = false;
        log.debug("[KnowledgeGraph] Saved {} nodes, {} edges", nodes.size(), edges.size());
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
    }

    private record Hop(String nodeId, int depth) {
    }
}
