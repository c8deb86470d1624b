package com.openforge.memgraph.service;

import com.openforge.memgraph.config.CollaboratorGuard;
import com.openforge.memgraph.config.MemoryProperties;
import com.openforge.memgraph.consistency.ConsistencyChecker;
import com.openforge.memgraph.consistency.NamespaceWriteGate;
import com.openforge.memgraph.consistency.WriteOutcome;
import com.openforge.memgraph.embedding.Embedder;
import com.openforge.memgraph.error.NodeNotFoundException;
import com.openforge.memgraph.goal.ParseMode;
import com.openforge.memgraph.goal.TaskGoalParser;
import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.model.MemoryType;
import com.openforge.memgraph.model.ParsedTaskGoal;
import com.openforge.memgraph.reasoning.MemoryReorganizer;
import com.openforge.memgraph.reasoning.ReasoningResult;
import com.openforge.memgraph.reasoning.RelationReasoningEngine;
import com.openforge.memgraph.retrieve.HybridRetriever;
import com.openforge.memgraph.retrieve.RetrievalResult;
import com.openforge.memgraph.retrieve.RetrievalStatus;
import com.openforge.memgraph.store.MemoryGraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Entry point for callers: the read path (Parse → Embed → Retrieve), the gated
 * write path (CheckAndCommit, then background reorganisation) and on-demand ProcessNode.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryCoreService {

    private final TaskGoalParser          goalParser;
    private final HybridRetriever         retriever;
    private final ConsistencyChecker      checker;
    private final RelationReasoningEngine reasoningEngine;
    private final MemoryReorganizer       reorganizer;
    private final NamespaceWriteGate      writeGate;
    private final MemoryGraphStore        store;
    private final Embedder                embedder;
    private final CollaboratorGuard       guard;
    private final MemoryProperties        props;

    /** A parsed goal together with what it retrieved. */
    public record SearchResult(ParsedTaskGoal goal, RetrievalResult retrieval) {}

    public ParsedTaskGoal parse(String task, ParseMode mode, @Nullable String context) {
        return goalParser.parse(task, mode, context);
    }

    /**
     * @param scope null searches every memory tier
     */
    public SearchResult search(String namespace, String query, ParseMode mode,
                               @Nullable MemoryType scope, int topK, @Nullable String context) {
        ParsedTaskGoal goal = goalParser.parse(query, mode, context);
        String text = goal.rephrasedQuery() != null ? goal.rephrasedQuery() : query;

        List<Float> queryEmbedding = null;
        try {
            queryEmbedding = embedder.embed(text);
        } catch (RuntimeException e) {
            log.warn("[Search] Query embedding failed (namespace={}, op=search): {}", namespace, e.getMessage());
        }

        RetrievalResult result = retriever.retrieve(goal, queryEmbedding, scope, topK, namespace);
        if (queryEmbedding == null && result.status() != RetrievalStatus.UNAVAILABLE) {
            List<String> failed = new ArrayList<>(result.failedStages());
            failed.add("query-embedding");
            result = new RetrievalResult(result.hits(), RetrievalStatus.DEGRADED, failed);
        }
        log.debug("[Search] ns={} query='{}' hits={} status={}", namespace, text, result.hits().size(), result.status());
        return new SearchResult(goal, result);
    }

    /** Serialized per namespace; committed and flagged nodes are handed to the reorganizer. */
    public WriteOutcome write(String namespace, MemoryNode candidate) {
        WriteOutcome outcome = writeGate.run(namespace, () -> checker.checkAndCommit(candidate, namespace));
        if (outcome.written()) {
            reorganizer.submit(outcome.nodeId(), namespace);
        }
        return outcome;
    }

    public MemoryNode getNode(String namespace, String nodeId) {
        return guard.call("store", namespace, "getNode", () -> store.getNode(nodeId, namespace))
                .orElseThrow(() -> new NodeNotFoundException(nodeId, namespace));
    }

    public ReasoningResult reason(String namespace, String nodeId, Set<String> excludeIds, @Nullable Integer topK) {
        MemoryNode anchor = getNode(namespace, nodeId);
        int k = topK == null ? props.reasoning().topK() : topK;
        return reasoningEngine.processNode(anchor, excludeIds == null ? Set.of() : excludeIds, k, namespace);
    }
}
