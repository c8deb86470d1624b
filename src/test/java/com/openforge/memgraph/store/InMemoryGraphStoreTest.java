package com.openforge.memgraph.store;

import com.openforge.memgraph.config.MemoryProperties;
import com.openforge.memgraph.error.InvariantViolationException;
import com.openforge.memgraph.error.NodeNotFoundException;
import com.openforge.memgraph.model.MemoryEdge;
import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.model.MemoryType;
import com.openforge.memgraph.model.NodeStatus;
import com.openforge.memgraph.model.RelationType;
import com.openforge.memgraph.model.SourceRef;
import com.openforge.memgraph.support.HashingEmbedder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.openforge.memgraph.support.TestFixtures.NS;
import static com.openforge.memgraph.support.TestFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryGraphStoreTest {

    private final HashingEmbedder embedder = new HashingEmbedder();
    private InMemoryGraphStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore(new MemoryProperties.Namespaces(HashingEmbedder.DIMENSION, Map.of("small", 3)));
    }

    @Test
    void rejectsEmbeddingOfWrongDimension() {
        MemoryNode n = node(embedder, "a", "Caroline likes hiking", 1);

        assertThatThrownBy(() -> store.addNode(n, "small"))
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("dimension");
        assertThat(store.getNode("a", "small")).isEmpty();
    }

    @Test
    void overlongTextIsRejectedNotCut() {
        MemoryNode n = node(embedder, "long", "a".repeat(MemoryInvariants.MAX_TEXT_LENGTH + 1), 1);

        assertThatThrownBy(() -> store.addNode(n, NS))
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("limit is " + MemoryInvariants.MAX_TEXT_LENGTH);
        assertThat(store.getNode("long", NS)).isEmpty();
    }

    @Test
    void textAtTheLimitIsStoredWhole() {
        String text = "a".repeat(MemoryInvariants.MAX_TEXT_LENGTH);
        store.addNode(node(embedder, "full", text, 1), NS);

        assertThat(store.getNode("full", NS).orElseThrow().text()).isEqualTo(text);
    }

    @Test
    void namespacesAreIsolated() {
        store.addNode(node(embedder, "a", "Caroline likes hiking", 1), NS);

        assertThat(store.getNode("a", NS)).isPresent();
        assertThat(store.getNode("a", "tenant-b")).isEmpty();
    }

    @Test
    void updateOfMissingNodeIsNotFound() {
        assertThatThrownBy(() -> store.updateNode(node(embedder, "ghost", "nothing", 1), NS))
                .isInstanceOf(NodeNotFoundException.class);
    }

    @Test
    void mergedNodeNeedsSuccessor() {
        MemoryNode merged = node(embedder, "a", "Caroline likes hiking", 1).toBuilder()
                .status(NodeStatus.MERGED)
                .build();

        assertThatThrownBy(() -> store.addNode(merged, NS)).isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void followsEdgeMustPointForwardInTime() {
        store.addNode(node(embedder, "early", "Caroline joined the group", 100), NS);
        store.addNode(node(embedder, "late", "Caroline led a meeting", 200), NS);

        store.addEdge(MemoryEdge.of("early", "late", RelationType.FOLLOWS), NS);

        assertThatThrownBy(() -> store.addEdge(MemoryEdge.of("late", "early", RelationType.FOLLOWS), NS))
                .isInstanceOf(InvariantViolationException.class);
        assertThat(store.outgoingEdges("early", EnumSet.of(RelationType.FOLLOWS), NS)).hasSize(1);
    }

    @Test
    void edgeEndpointsMustExist() {
        store.addNode(node(embedder, "a", "Caroline likes hiking", 1), NS);

        assertThatThrownBy(() -> store.addEdge(MemoryEdge.of("a", "missing", RelationType.RELATED_TO), NS))
                .isInstanceOf(InvariantViolationException.class);
        assertThatThrownBy(() -> store.addEdge(MemoryEdge.of("a", "a", RelationType.RELATED_TO), NS))
                .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void aggregateMustListAtLeastTwoSources() {
        store.addNode(node(embedder, "m1", "Caroline hikes", 1), NS);
        store.addNode(node(embedder, "m2", "Caroline climbs", 2), NS);
        MemoryNode thin = node(embedder, "agg", "Caroline is outdoorsy", 3).toBuilder()
                .sources(List.of(SourceRef.node("m1")))
                .build();
        store.addNode(thin, NS);

        assertThatThrownBy(() -> store.addEdge(MemoryEdge.of("agg", "m1", RelationType.AGGREGATES), NS))
                .isInstanceOf(InvariantViolationException.class);

        store.updateNode(thin.toBuilder().sources(List.of(SourceRef.node("m1"), SourceRef.node("m2"))).build(), NS);
        store.addEdge(MemoryEdge.of("agg", "m1", RelationType.AGGREGATES), NS);
        assertThat(store.traverse("m1", EnumSet.of(RelationType.AGGREGATES), 1, NS))
                .extracting(MemoryNode::id).containsExactly("agg");
    }

    @Test
    void traverseFollowsEdgesBothWaysAndHonoursDepth() {
        store.addNode(node(embedder, "a", "one", 1), NS);
        store.addNode(node(embedder, "b", "two", 2), NS);
        store.addNode(node(embedder, "c", "three", 3), NS);
        store.addEdge(MemoryEdge.of("a", "b", RelationType.RELATED_TO), NS);
        store.addEdge(MemoryEdge.of("c", "b", RelationType.RELATED_TO), NS);

        Set<RelationType> related = EnumSet.of(RelationType.RELATED_TO);
        assertThat(store.traverse("b", related, 1, NS)).extracting(MemoryNode::id).containsExactlyInAnyOrder("a", "c");
        assertThat(store.traverse("a", related, 1, NS)).extracting(MemoryNode::id).containsExactly("b");
        assertThat(store.traverse("a", related, 2, NS)).extracting(MemoryNode::id).containsExactly("b", "c");
        assertThat(store.traverse("a", EnumSet.of(RelationType.CAUSES), 2, NS)).isEmpty();
    }

    @Test
    void deleteRemovesIncidentEdges() {
        store.addNode(node(embedder, "a", "one", 1), NS);
        store.addNode(node(embedder, "b", "two", 2), NS);
        store.addEdge(MemoryEdge.of("a", "b", RelationType.CAUSES), NS);

        store.deleteNode("b", NS);

        assertThat(store.outgoingEdges("a", EnumSet.allOf(RelationType.class), NS)).isEmpty();
    }

    @Test
    void keywordSearchIsCaseInsensitiveAndScoped() {
        store.addNode(node(embedder, "a", "Caroline joined the LGBTQ support group", 1), NS);
        store.addNode(node(embedder, "w", "Caroline is in a meeting", 2).toBuilder()
                .memoryType(MemoryType.WORKING_MEMORY).build(), NS);
        store.addNode(node(embedder, "k", "Melanie paints", 3).toBuilder()
                .key("caroline's friend").tags(Set.of("art")).build(), NS);

        assertThat(store.keywordSearch(List.of("CAROLINE"), NS, MemoryType.LONG_TERM_MEMORY))
                .extracting(MemoryNode::id).containsExactlyInAnyOrder("a", "k");
        assertThat(store.keywordSearch(List.of("Art"), NS, null))
                .extracting(MemoryNode::id).containsExactly("k");
        assertThat(store.keywordSearch(List.of(" "), NS, null)).isEmpty();
    }

    @Test
    void vectorSearchRanksByCosine() {
        store.addNode(node(embedder, "apples", "User likes apples", 1), NS);
        store.addNode(node(embedder, "rex", "User has a dog named Rex", 2), NS);

        List<StoreHit> hits = store.vectorSearch(embedder.embed("apples"), NS, MemoryType.LONG_TERM_MEMORY, 2);

        assertThat(hits).extracting(h -> h.node().id()).containsExactly("apples", "rex");
        assertThat(hits.get(0).score()).isGreaterThan(hits.get(1).score());
    }
}
