package com.openforge.memgraph.reasoning;

import com.openforge.memgraph.config.CollaboratorGuard;
import com.openforge.memgraph.config.MemoryProperties;
import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.store.MemoryGraphStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs ProcessNode for freshly committed nodes in the background.
 * Disabled with memory.reasoning.reorganize-on-commit=false.
 *
 * Nobody waits on these runs, so every failure ends here as a log line and an empty result.
 */
@Slf4j
@Component
public class MemoryReorganizer {

    private final RelationReasoningEngine    engine;
    private final MemoryGraphStore           store;
    private final CollaboratorGuard          guard;
    private final ExecutorService            executor;
    private final MemoryProperties.Reasoning config;

    public MemoryReorganizer(RelationReasoningEngine engine,
                             MemoryGraphStore store,
                             CollaboratorGuard guard,
                             @Qualifier("reorganizerExecutor") ExecutorService executor,
                             MemoryProperties props) {
        this.engine   = engine;
        this.store    = store;
        this.guard    = guard;
        this.executor = executor;
        this.config   = props.reasoning();
    }

    /**
     * @return the run's result, or {@link ReasoningResult#empty()} when disabled, when the
     *         node is gone, or when the run failed (the failure is logged)
     */
    public CompletableFuture<ReasoningResult> submit(String nodeId, String namespace) {
        if (!config.reorganizeOnCommit()) {
            return CompletableFuture.completedFuture(ReasoningResult.empty());
        }
        try {
            return CompletableFuture.supplyAsync(() -> reorganize(nodeId, namespace), executor);
        } catch (RejectedExecutionException e) {
            log.warn("[Reorganizer] Not scheduling {} (namespace={}): {}", nodeId, namespace, e.getMessage());
            return CompletableFuture.completedFuture(ReasoningResult.empty());
        }
    }

    private ReasoningResult reorganize(String nodeId, String namespace) {
        try {
            return guard.call("store", namespace, "getNode", () -> store.getNode(nodeId, namespace))
                    .filter(MemoryNode::isActive)
                    .map(n -> engine.processNode(n, Set.of(), config.topK(), namespace))
                    .orElseGet(() -> {
                        log.debug("[Reorganizer] {} no longer active (namespace={}), skipping", nodeId, namespace);
                        return ReasoningResult.empty();
                    });
        } catch (RuntimeException e) {
            log.warn("[Reorganizer] ProcessNode for {} failed (namespace={}): {}", nodeId, namespace, e.toString());
            return ReasoningResult.empty();
        }
    }
}
