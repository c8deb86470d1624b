package com.openforge.memgraph.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memgraph.config.CollaboratorGuard;
import com.openforge.memgraph.config.MemoryProperties;
import com.openforge.memgraph.consistency.ConsistencyChecker;
import com.openforge.memgraph.consistency.NamespaceWriteGate;
import com.openforge.memgraph.consistency.PerspectiveAdjuster;
import com.openforge.memgraph.consistency.WriteDecision;
import com.openforge.memgraph.consistency.WriteOutcome;
import com.openforge.memgraph.goal.ParseMode;
import com.openforge.memgraph.goal.TaskGoalParser;
import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.model.MemoryType;
import com.openforge.memgraph.reasoning.MemoryReorganizer;
import com.openforge.memgraph.reasoning.RelationReasoningEngine;
import com.openforge.memgraph.retrieve.HybridRetriever;
import com.openforge.memgraph.retrieve.RetrievalResult;
import com.openforge.memgraph.retrieve.RetrievalStatus;
import com.openforge.memgraph.store.InMemoryGraphStore;
import com.openforge.memgraph.support.HashingEmbedder;
import com.openforge.memgraph.support.RuleBasedNliClassifier;
import com.openforge.memgraph.support.ScriptedLanguageModel;
import com.openforge.memgraph.support.TestFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.openforge.memgraph.support.TestFixtures.NS;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Write a conversation's worth of facts, then ask about one event.
 */
class SupportGroupRecallTest {

    private static final String QUESTION = "When did Caroline go to the LGBTQ support group?";

    private final HashingEmbedder       embedder = new HashingEmbedder();
    private final ScriptedLanguageModel model    = new ScriptedLanguageModel().when(QUESTION, """
            {"keys": ["Caroline", "LGBTQ support group"], "tags": [], "goal_type": "retrieval"}""");
    private ExecutorService   ioPool;
    private ExecutorService   reasoningPool;
    private ExecutorService   reorgPool;
    private MemoryCoreService service;

    @BeforeEach
    void setUp() {
        ioPool        = Executors.newCachedThreadPool();
        reasoningPool = Executors.newFixedThreadPool(2);
        reorgPool     = Executors.newSingleThreadExecutor();
        MemoryProperties props = TestFixtures.props()
                .withReasoning(new MemoryProperties.Reasoning(2, 3, 2, 2, false, 5));
        InMemoryGraphStore store = new InMemoryGraphStore(props.namespaces());
        CollaboratorGuard guard = TestFixtures.guard(ioPool);
        ObjectMapper mapper = new ObjectMapper();

        HybridRetriever retriever = new HybridRetriever(store, embedder, guard, props);
        ConsistencyChecker checker = new ConsistencyChecker(store, embedder, retriever,
                new RuleBasedNliClassifier(), new PerspectiveAdjuster(), guard, props);
        RelationReasoningEngine engine = new RelationReasoningEngine(store, embedder, model, mapper,
                guard, reasoningPool, props);
        service = new MemoryCoreService(new TaskGoalParser(model, mapper), retriever, checker, engine,
                new MemoryReorganizer(engine, store, guard, reorgPool, props), new NamespaceWriteGate(),
                store, embedder, guard, props);
    }

    @AfterEach
    void tearDown() {
        ioPool.shutdownNow();
        reasoningPool.shutdownNow();
        reorgPool.shutdownNow();
    }

    private String remember(String text) {
        WriteOutcome outcome = service.write(NS, MemoryNode.builder()
                .text(text)
                .memoryType(MemoryType.LONG_TERM_MEMORY)
                .confidence(0.9)
                .build());
        assertThat(outcome.decision()).isEqualTo(WriteDecision.COMMITTED);
        return outcome.nodeId();
    }

    @Test
    void bothSupportGroupMemoriesAreRecalledWithTheDatedOneFirst() {
        Map<String, String> ids = new LinkedHashMap<>();
        ids.put("went", remember("Caroline went to the LGBTQ support group on 7 May 2023"));
        ids.put("felt", remember("Caroline said the LGBTQ support group made her feel accepted and brave"));
        remember("Caroline is researching adoption agencies");
        remember("Melanie painted a sunrise over the lake last year");
        remember("Melanie took her kids camping in the mountains");
        remember("Jon opened a dance studio downtown");
        remember("Gina launched an online clothing store");

        RetrievalResult result = service.search(NS, QUESTION, ParseMode.FAST, null, 5, null).retrieval();

        assertThat(result.status()).isEqualTo(RetrievalStatus.OK);
        assertThat(result.nodes()).extracting(MemoryNode::id).contains(ids.get("went"), ids.get("felt"));
        assertThat(result.nodes().get(0).id()).isEqualTo(ids.get("went"));
        assertThat(result.nodes()).hasSizeLessThanOrEqualTo(5);
    }

    @Test
    void joinedAndAttendedAreBothInTheTopFive() {
        String joined   = remember("Caroline joined the LGBTQ support group in 2023.");
        String attended = remember("She attended the weekly LGBTQ support group meetings every Friday.");
        remember("Melanie painted a sunrise over the lake last year");
        remember("Jon opened a dance studio downtown");

        RetrievalResult result = service.search(NS, QUESTION, ParseMode.FAST, null, 5, null).retrieval();

        assertThat(result.nodes()).extracting(MemoryNode::id).startsWith(joined).contains(attended);
    }

    @Test
    void repeatingAFactDoesNotGrowTheGraph() {
        String first = remember("Caroline went to the LGBTQ support group on 7 May 2023");

        WriteOutcome again = service.write(NS, MemoryNode.builder()
                .text("Caroline went to the LGBTQ support group on 7 May 2023")
                .memoryType(MemoryType.LONG_TERM_MEMORY)
                .build());

        assertThat(again.decision()).isEqualTo(WriteDecision.SKIPPED_DUPLICATE);
        assertThat(again.relatedId()).isEqualTo(first);
        assertThat(service.search(NS, QUESTION, ParseMode.FAST, null, 5, null).retrieval().nodes())
                .extracting(MemoryNode::id)
                .containsExactly(first);
    }
}
