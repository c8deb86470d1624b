package com.openforge.memgraph.reasoning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memgraph.model.MemoryEdge;
import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.model.RelationType;
import com.openforge.memgraph.model.SourceRef;
import com.openforge.memgraph.store.InMemoryGraphStore;
import com.openforge.memgraph.support.HashingEmbedder;
import com.openforge.memgraph.support.ScriptedLanguageModel;
import com.openforge.memgraph.support.TestFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.openforge.memgraph.support.TestFixtures.NS;
import static org.assertj.core.api.Assertions.assertThat;

class RelationReasoningEngineTest {

    private static final String NONE = "{\"relation\": \"NONE\"}";

    private final HashingEmbedder       embedder = new HashingEmbedder();
    private final ScriptedLanguageModel model    = new ScriptedLanguageModel().otherwise(m -> NONE);
    private ExecutorService         guardPool;
    private ExecutorService         reasoningPool;
    private InMemoryGraphStore      store;
    private RelationReasoningEngine engine;

    @BeforeEach
    void setUp() {
        guardPool     = Executors.newCachedThreadPool();
        reasoningPool = Executors.newFixedThreadPool(4);
        store         = new InMemoryGraphStore(TestFixtures.props().namespaces());
        engine        = new RelationReasoningEngine(store, embedder, model, new ObjectMapper(),
                TestFixtures.guard(guardPool), reasoningPool, TestFixtures.props());
    }

    @AfterEach
    void tearDown() {
        guardPool.shutdownNow();
        reasoningPool.shutdownNow();
    }

    private MemoryNode add(String id, String text, long epochSecond) {
        MemoryNode node = TestFixtures.node(embedder, id, text, epochSecond);
        store.addNode(node, NS);
        return node;
    }

    private MemoryNode add(MemoryNode node) {
        store.addNode(node, NS);
        return node;
    }

    @Test
    void followsAlwaysPointsFromEarlierToLater() {
        add("joined", "Caroline joined the support group", 100);
        MemoryNode anchor = add("speech", "Caroline gave a speech at the support group", 200);
        // the model claims the anchor came first; timestamps win
        model.when("B: Caroline joined", "{\"relation\": \"FOLLOWS\", \"direction\": \"A_TO_B\", \"confidence\": 0.8}");

        ReasoningResult result = engine.processNode(anchor, Set.of(), 5, NS);

        assertThat(result.sequenceLinks()).containsExactly(
                new MemoryEdge("joined", "speech", RelationType.FOLLOWS, 0.8));
        assertThat(result.relations()).isEmpty();
        assertThat(store.outgoingEdges("joined", EnumSet.of(RelationType.FOLLOWS), NS)).hasSize(1);
    }

    @Test
    void causalPairAddsCauseEdgeAndSequence() {
        add("rain", "Heavy rain flooded the street", 100);
        MemoryNode anchor = add("late", "Melanie arrived late to work", 200);
        model.when("B: Heavy rain", "{\"relation\": \"CAUSE\", \"direction\": \"B_TO_A\", \"confidence\": 0.7}");

        ReasoningResult result = engine.processNode(anchor, Set.of(), 5, NS);

        assertThat(result.relations()).containsExactly(
                new MemoryEdge("rain", "late", RelationType.CAUSES, 0.7));
        assertThat(result.sequenceLinks()).containsExactly(
                new MemoryEdge("rain", "late", RelationType.FOLLOWS, 0.7));
        assertThat(result.failures()).isZero();
    }

    @Test
    void causalChainYieldsInferredNodeWithWeakestConfidence() {
        MemoryNode anchor = add("layoff", "Jon lost his job at the bank", 100);
        add("studio", "Jon opened a dance studio", 200);
        add("students", "Jon teaches dance to forty students", 300);
        store.addEdge(new MemoryEdge("studio", "students", RelationType.CAUSES, 0.6), NS);
        model.when("B: Jon opened", "{\"relation\": \"CAUSE\", \"direction\": \"A_TO_B\", \"confidence\": 0.9}")
             .when("1. ", "{\"inference\": \"Losing his job led Jon to a new career teaching dance\"}");

        ReasoningResult result = engine.processNode(anchor, Set.of(), 5, NS);

        assertThat(result.inferredNodes()).hasSize(1);
        MemoryNode inferred = result.inferredNodes().get(0);
        assertThat(inferred.text()).isEqualTo("Losing his job led Jon to a new career teaching dance");
        assertThat(inferred.confidence()).isEqualTo(0.6);
        assertThat(inferred.sources()).extracting(SourceRef::nodeId)
                .containsExactly("layoff", "studio", "students");
        assertThat(store.outgoingEdges(inferred.id(), EnumSet.of(RelationType.RELATED_TO), NS))
                .extracting(MemoryEdge::targetId)
                .containsExactlyInAnyOrder("layoff", "studio", "students");
        assertThat(store.getNode("layoff", NS).orElseThrow().text()).isEqualTo("Jon lost his job at the bank");
    }

    @Test
    void keyClusterIsAggregatedOnce() {
        MemoryNode anchor = add(TestFixtures.node(embedder, "tent", "Melanie camped in a tent", 100)
                .toBuilder().key("camping").confidence(0.8).build());
        add(TestFixtures.node(embedder, "lake", "Melanie camped by the lake", 200)
                .toBuilder().key("Camping").build());
        model.when("1. ", "{\"key\": \"camping\", \"summary\": \"Melanie goes camping often\", \"tags\": [\"outdoors\"]}");

        ReasoningResult first = engine.processNode(anchor, Set.of(), 5, NS);

        assertThat(first.aggregateNodes()).hasSize(1);
        MemoryNode aggregate = first.aggregateNodes().get(0);
        assertThat(aggregate.key()).isEqualTo("camping");
        assertThat(aggregate.confidence()).isEqualTo(0.8);
        assertThat(aggregate.sources()).extracting(SourceRef::nodeId).containsExactlyInAnyOrder("tent", "lake");
        assertThat(store.outgoingEdges(aggregate.id(), EnumSet.of(RelationType.AGGREGATES), NS))
                .extracting(MemoryEdge::targetId)
                .containsExactlyInAnyOrder("tent", "lake");

        ReasoningResult second = engine.processNode(anchor, Set.of(), 5, NS);

        assertThat(second.aggregateNodes()).isEmpty();
    }

    @Test
    void failingPairIsCountedNotThrown() {
        add("a", "Caroline paints sunsets", 100);
        add("b", "Caroline visited Sweden", 200);
        MemoryNode anchor = add("c", "Caroline painted a lake", 300);
        model.when("B: Caroline paints", (String) null)
             .when("B: Caroline visited", "{\"relation\": \"RELATED_TO\", \"confidence\": 0.5}");

        ReasoningResult result = engine.processNode(anchor, Set.of(), 5, NS);

        assertThat(result.failures()).isEqualTo(1);
        assertThat(result.relations()).containsExactly(
                new MemoryEdge("c", "b", RelationType.RELATED_TO, 0.5));
    }

    @Test
    void excludedNodesAreNeverCompared() {
        add("a", "Caroline paints sunsets", 100);
        add("b", "Caroline visited Sweden", 200);
        MemoryNode anchor = add("c", "Caroline painted a lake", 300);

        engine.processNode(anchor, Set.of("a"), 5, NS);

        assertThat(model.calls()).hasSize(1);
        assertThat(model.calls().get(0).get(1).content()).contains("B: Caroline visited Sweden");
    }

    @Test
    void loneNodeProducesNothing() {
        MemoryNode anchor = add("solo", "Caroline paints sunsets", 100);

        ReasoningResult result = engine.processNode(anchor, Set.of(), 5, NS);

        assertThat(result).isEqualTo(ReasoningResult.empty());
        assertThat(model.calls()).isEmpty();
    }
}
