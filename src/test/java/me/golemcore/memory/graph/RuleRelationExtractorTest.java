package me.golemcore.memory.graph;

import me.golemcore.memory.domain.model.GraphNode;
import me.golemcore.memory.domain.model.RelationType;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleRelationExtractorTest {

    private MemoryProperties.GraphProperties config;
    private RuleRelationExtractor extractor;

    @BeforeEach
    void setUp() {
        config = new MemoryProperties.GraphProperties();
        extractor = new RuleRelationExtractor(config);
    }

    @Test
    void shouldLinkCategoryMembersOnlyToAnchors() {
        List<GraphNode> nodes = nodes(100, "music");

        List<ProposedRelation> relations = extractor.extract(nodes);

        long touchingMember = relations.stream()
                .filter(relation -> relation.sourceId().equals("n050") || relation.targetId().equals("n050"))
                .count();
        assertEquals(config.getAnchorsPerCategory(), touchingMember);
        Set<String> anchors = Set.of("n000", "n001", "n002");
        assertTrue(relations.stream()
                .allMatch(relation -> anchors.contains(relation.sourceId()) || anchors.contains(relation.targetId())));
        assertTrue(relations.stream().allMatch(relation -> relation.relationType() == RelationType.RELATED_TO));
    }

    @Test
    void shouldLinkSingleNodeToAtMostAnchorsPerCategory() {
        List<GraphNode> nodes = nodes(100, "music");
        RuleRelationExtractor.NodeIndex index = extractor.index(nodes);

        List<ProposedRelation> forAnchor = extractor.extractFor(nodes.get(1), index);
        List<ProposedRelation> forMember = extractor.extractFor(nodes.get(70), index);

        assertEquals(Set.of("n000", "n002", "n003"), targets(forAnchor));
        assertEquals(Set.of("n000", "n001", "n002"), targets(forMember));
        assertTrue(forMember.stream()
                .allMatch(relation -> relation.description().equals(RuleRelationExtractor.SAME_CATEGORY)));
    }

    @Test
    void shouldKeepOnlyTopKeywordNeighbours() {
        config.setKeywordTopK(2);
        List<GraphNode> nodes = new ArrayList<>();
        nodes.add(node("focus", null, "piano", "jazz"));
        nodes.add(node("both", null, "piano", "jazz"));
        nodes.add(node("half1", null, "piano"));
        nodes.add(node("half2", null, "jazz"));
        nodes.add(node("half3", null, "piano"));

        List<ProposedRelation> relations = extractor.extractFor(nodes.get(0), extractor.index(nodes));

        assertEquals(2, relations.size());
        assertEquals("both", relations.get(0).targetId());
        assertEquals(1.0, relations.get(0).confidence());
        assertEquals(0.5, relations.get(1).confidence());
    }

    @Test
    void shouldTruncateKeywordSharedByEveryNode() {
        config.setMaxIdsPerKeyword(5);
        config.setKeywordTopK(50);
        List<GraphNode> nodes = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            nodes.add(node(String.format("n%03d", i), null, "common"));
        }

        RuleRelationExtractor.NodeIndex index = extractor.index(nodes);
        List<ProposedRelation> relations = extractor.extractFor(nodes.get(39), index);

        assertEquals(5, index.postings().get("common").size());
        assertEquals(Set.of("n000", "n001", "n002", "n003", "n004"), targets(relations));
    }

    @Test
    void shouldSkipWeakKeywordOverlap() {
        List<GraphNode> nodes = List.of(
                node("wide", null, "a", "b", "c", "d", "e", "f"),
                node("narrow", null, "a"));

        assertTrue(extractor.extractFor(nodes.get(0), extractor.index(nodes)).isEmpty());
    }

    @Test
    void shouldCapRelationsAtCeilingKeepingMostConfident() {
        config.setMaxRuleRelations(10);
        List<GraphNode> nodes = new ArrayList<>(nodes(50, "music"));
        nodes.add(node("x1", null, "rare"));
        nodes.add(node("x2", null, "rare"));

        List<ProposedRelation> relations = extractor.extract(nodes);

        assertEquals(10, relations.size());
        assertEquals(1.0, relations.get(0).confidence());
        assertTrue(relations.stream().allMatch(relation -> relation.confidence() >= config.getCategoryConfidence()));
    }

    @Test
    void shouldIgnoreNodesWithoutCategoryOrKeywords() {
        List<GraphNode> nodes = List.of(node("a", null), node("b", null));

        assertTrue(extractor.extract(nodes).isEmpty());
    }

    private static List<GraphNode> nodes(int count, String category) {
        List<GraphNode> nodes = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            nodes.add(node(String.format("n%03d", i), category));
        }
        return nodes;
    }

    private static GraphNode node(String id, String category, String... keywords) {
        return GraphNode.builder()
                .id(id)
                .title("Title " + id)
                .category(category)
                .keywords(new LinkedHashSet<>(List.of(keywords)))
                .build();
    }

    private static Set<String> targets(List<ProposedRelation> relations) {
        return relations.stream().map(ProposedRelation::targetId).collect(Collectors.toSet());
    }
}
