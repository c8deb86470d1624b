package com.openforge.memgraph.reasoning;

import com.openforge.memgraph.model.MemoryNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TagClustersTest {

    private static MemoryNode node(String id, String key, String... tags) {
        return MemoryNode.builder().id(id).text(id).key(key).tags(Set.of(tags)).build();
    }

    @Test
    void sameKeyIgnoringCaseLinks() {
        assertThat(TagClusters.linked(node("a", "Camping"), node("b", " camping "))).isTrue();
    }

    @Test
    void oneSharedTagIsNotEnough() {
        assertThat(TagClusters.linked(node("a", null, "family", "beach"), node("b", null, "family", "work")))
                .isFalse();
        assertThat(TagClusters.linked(node("a", null, "Family", "beach"), node("b", null, "family", "BEACH")))
                .isTrue();
    }

    @Test
    void clustersAreTransitiveAndLargestFirst() {
        List<List<MemoryNode>> clusters = TagClusters.of(List.of(
                node("a", "painting"),
                node("b", "Painting", "art", "hobby"),
                node("c", null, "art", "hobby"),
                node("d", "career"),
                node("e", "career"),
                node("f", "alone")));

        assertThat(clusters).hasSize(2);
        assertThat(clusters.get(0)).extracting(MemoryNode::id).containsExactly("a", "b", "c");
        assertThat(clusters.get(1)).extracting(MemoryNode::id).containsExactly("d", "e");
    }
}
