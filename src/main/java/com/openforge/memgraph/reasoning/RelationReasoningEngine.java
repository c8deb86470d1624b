package com.openforge.memgraph.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memgraph.config.CollaboratorGuard;
import com.openforge.memgraph.config.MemoryProperties;
import com.openforge.memgraph.embedding.Embedder;
import com.openforge.memgraph.error.MalformedResponseException;
import com.openforge.memgraph.error.MemoryCoreException;
import com.openforge.memgraph.llm.LanguageModel;
import com.openforge.memgraph.llm.LlmJson;
import com.openforge.memgraph.llm.StructuredCompletion;
import com.openforge.memgraph.llm.model.Message;
import com.openforge.memgraph.model.MemoryEdge;
import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.model.RelationType;
import com.openforge.memgraph.model.SourceRef;
import com.openforge.memgraph.store.MemoryGraphStore;
import com.openforge.memgraph.store.StoreHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Discovers relations around one anchor node and writes what it finds.
 *
 * Flow:
 *   1. neighbours   — topK nearest active nodes, minus excludeIds and the anchor
 *   2. pairs        — one LLM call per (anchor, neighbour), run on the reasoning pool
 *   3. sequence     — FOLLOWS earlier → later, only for pairs judged causal or sequential
 *   4. inference    — one LLM call per 2–3 edge CAUSES chain that uses a new edge
 *   5. aggregation  — one LLM call per key / tag cluster not yet summarised
 *   6. writes       — only after everything above finished; a failed edge on a new node
 *                     deletes that node again
 *
 * A failing pair, chain or cluster is counted in {@link ReasoningResult#failures()}
 * and never aborts the batch. Cancellation (caller interrupt) discards all work before
 * anything is written. Existing node text is never modified.
 */
@Slf4j
@Service
public class RelationReasoningEngine {

    private static final Set<RelationType> CAUSAL    = EnumSet.of(RelationType.CAUSES);
    private static final Set<RelationType> AGGREGATE = EnumSet.of(RelationType.AGGREGATES);

    private final MemoryGraphStore           store;
    private final Embedder                   embedder;
    private final StructuredCompletion       completion;
    private final CollaboratorGuard          guard;
    private final ExecutorService            executor;
    private final MemoryProperties.Reasoning config;

    public RelationReasoningEngine(MemoryGraphStore store,
                                   Embedder embedder,
                                   LanguageModel languageModel,
                                   ObjectMapper objectMapper,
                                   CollaboratorGuard guard,
                                   @Qualifier("reasoningExecutor") ExecutorService executor,
                                   MemoryProperties props) {
        this.store      = store;
        this.embedder   = embedder;
        this.completion = new StructuredCompletion(languageModel, objectMapper);
        this.guard      = guard;
        this.executor   = executor;
        this.config     = props.reasoning();
    }

    /** Relation verdict for one (anchor, neighbour) pair. */
    private record PairVerdict(MemoryNode neighbour, RelationType type, boolean anchorFirst, double confidence) {}

    /** A synthesized node plus the edges that attach it to the graph. */
    private record Draft(MemoryNode node, List<MemoryEdge> edges) {}

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * @param excludeIds nodes never used as neighbours; the anchor is always excluded
     * @throws com.openforge.memgraph.error.CollaboratorUnavailableException when neighbours cannot be read
     * @throws CancellationException when the calling thread is interrupted; nothing is written
     */
    public ReasoningResult processNode(MemoryNode anchor, Set<String> excludeIds, int topK, String namespace) {
        Set<String> excluded = new HashSet<>(excludeIds);
        excluded.add(anchor.id());
        List<MemoryNode> neighbours = neighbours(anchor, excluded, topK, namespace);
        if (neighbours.isEmpty()) {
            log.debug("[Reasoning] {} has no neighbours (namespace={})", anchor.id(), namespace);
            return ReasoningResult.empty();
        }
        AtomicInteger failures = new AtomicInteger();

        // ── Pairwise relations ───────────────────────────────────────────────
        List<Callable<PairVerdict>> pairTasks = new ArrayList<>();
        for (MemoryNode n : neighbours) pairTasks.add(() -> classify(anchor, n));
        List<PairVerdict> verdicts = runAll(pairTasks, failures, "pair");

        List<MemoryEdge> relations = new ArrayList<>();
        List<MemoryEdge> sequence  = new ArrayList<>();
        for (PairVerdict v : verdicts) {
            toEdges(anchor, v, relations, sequence);
        }

        // ── Causal chains ────────────────────────────────────────────────────
        Map<String, MemoryNode> byId = new LinkedHashMap<>();
        byId.put(anchor.id(), anchor);
        neighbours.forEach(n -> byId.put(n.id(), n));

        Set<MemoryEdge> fresh = new LinkedHashSet<>();
        relations.stream().filter(e -> e.relationType() == RelationType.CAUSES).forEach(fresh::add);
        List<MemoryEdge> causal = new ArrayList<>(fresh);
        causal.addAll(persistedCausalEdges(byId, fresh, failures, namespace));

        List<Callable<Draft>> inferTasks = new ArrayList<>();
        CausalChains.find(causal).stream()
                .filter(c -> c.uses(fresh))
                .limit(Math.max(0, config.maxInferences()))
                .forEach(c -> inferTasks.add(() -> infer(c, byId, anchor)));
        List<Draft> inferred = runAll(inferTasks, failures, "chain");

        // ── Aggregates ───────────────────────────────────────────────────────
        List<MemoryNode> clusterable = Stream.concat(Stream.of(anchor), neighbours.stream())
                .filter(n -> !synthesized(n))
                .toList();
        List<Callable<Draft>> aggregateTasks = new ArrayList<>();
        for (List<MemoryNode> cluster : TagClusters.of(clusterable)) {
            if (aggregateTasks.size() >= config.maxAggregates()) break;
            if (alreadyAggregated(cluster, failures, namespace)) continue;
            aggregateTasks.add(() -> aggregate(cluster, anchor));
        }
        List<Draft> aggregates = runAll(aggregateTasks, failures, "cluster");

        // ── Writes ───────────────────────────────────────────────────────────
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("ProcessNode cancelled before writing (anchor=" + anchor.id() + ")");
        }
        List<MemoryEdge> writtenRelations = writeEdges(relations, failures, namespace);
        List<MemoryEdge> writtenSequence  = writeEdges(sequence, failures, namespace);
        List<MemoryNode> writtenInferred  = writeDrafts(inferred, failures, namespace);
        List<MemoryNode> writtenAggregate = writeDrafts(aggregates, failures, namespace);

        ReasoningResult result = new ReasoningResult(writtenRelations, writtenInferred,
                writtenSequence, writtenAggregate, failures.get());
        log.info("[Reasoning] anchor={} ns={} relations={} follows={} inferred={} aggregates={} failures={}",
                anchor.id(), namespace, writtenRelations.size(), writtenSequence.size(),
                writtenInferred.size(), writtenAggregate.size(), result.failures());
        return result;
    }

    // ── Stages ───────────────────────────────────────────────────────────────

    private List<MemoryNode> neighbours(MemoryNode anchor, Set<String> excluded, int topK, String namespace) {
        if (topK <= 0 || anchor.embedding() == null || anchor.embedding().isEmpty()) return List.of();
        List<StoreHit> hits = guard.call("store", namespace, "vectorSearch",
                () -> store.vectorSearch(anchor.embedding(), namespace, anchor.memoryType(), topK + excluded.size()));
        return hits.stream()
                .map(StoreHit::node)
                .filter(n -> n.isActive() && !excluded.contains(n.id()))
                .limit(topK)
                .toList();
    }

    private PairVerdict classify(MemoryNode anchor, MemoryNode neighbour) {
        List<Message> messages = List.of(
                Message.system(RelationPrompts.PAIR_SYSTEM),
                Message.user(RelationPrompts.PAIR_USER.formatted(anchor.text(), neighbour.text())));
        PairVerdict verdict = completion.request("relation", messages, config.maxAttempts(),
                node -> toVerdict(node, neighbour));
        return verdict.type() == null ? null : verdict;
    }

    private static PairVerdict toVerdict(JsonNode node, MemoryNode neighbour) {
        LlmJson.requireObject(node);
        String relation = LlmJson.requireText(node, "relation").toUpperCase(Locale.ROOT).replace(' ', '_');
        RelationType type = switch (relation) {
            case "CAUSE", "CAUSES"           -> RelationType.CAUSES;
            case "FOLLOWS", "FOLLOW"         -> RelationType.FOLLOWS;
            case "RELATED_TO", "RELATED"     -> RelationType.RELATED_TO;
            case "NONE"                      -> null;
            default -> throw new MalformedResponseException("Unknown relation '" + relation + "'");
        };
        String direction = LlmJson.optionalText(node, "direction");
        boolean anchorFirst = direction == null || !direction.equalsIgnoreCase("B_TO_A");
        double confidence = LlmJson.probability(node, "confidence", 1.0);
        return new PairVerdict(neighbour, type, anchorFirst, confidence);
    }

    /** FOLLOWS only ever points from the earlier to the later node. */
    private static void toEdges(MemoryNode anchor, PairVerdict v, List<MemoryEdge> relations, List<MemoryEdge> sequence) {
        MemoryNode n = v.neighbour();
        boolean ordered = anchor.updatedAt() != null && n.updatedAt() != null
                && !anchor.updatedAt().equals(n.updatedAt());
        MemoryNode earlier = ordered && anchor.updatedAt().isBefore(n.updatedAt()) ? anchor : n;
        MemoryNode later   = earlier == anchor ? n : anchor;

        switch (v.type()) {
            case CAUSES -> {
                MemoryNode cause  = v.anchorFirst() ? anchor : n;
                MemoryNode effect = cause == anchor ? n : anchor;
                relations.add(new MemoryEdge(cause.id(), effect.id(), RelationType.CAUSES, v.confidence()));
                if (ordered) sequence.add(new MemoryEdge(earlier.id(), later.id(), RelationType.FOLLOWS, v.confidence()));
            }
            case FOLLOWS -> {
                if (ordered) {
                    sequence.add(new MemoryEdge(earlier.id(), later.id(), RelationType.FOLLOWS, v.confidence()));
                } else {
                    relations.add(new MemoryEdge(anchor.id(), n.id(), RelationType.RELATED_TO, v.confidence()));
                }
            }
            default -> relations.add(new MemoryEdge(anchor.id(), n.id(), RelationType.RELATED_TO, v.confidence()));
        }
    }

    /** CAUSES edges already in the store between nodes of this neighbourhood. */
    private List<MemoryEdge> persistedCausalEdges(Map<String, MemoryNode> byId, Set<MemoryEdge> fresh,
                                                  AtomicInteger failures, String namespace) {
        List<MemoryEdge> out = new ArrayList<>();
        for (String id : byId.keySet()) {
            try {
                for (MemoryEdge e : guard.call("store", namespace, "outgoingEdges",
                        () -> store.outgoingEdges(id, CAUSAL, namespace))) {
                    boolean known = fresh.stream().anyMatch(f ->
                            f.sourceId().equals(e.sourceId()) && f.targetId().equals(e.targetId()));
                    if (byId.containsKey(e.targetId()) && !known) out.add(e);
                }
            } catch (MemoryCoreException e) {
                failures.incrementAndGet();
                log.warn("[Reasoning] Could not read CAUSES edges of {} (namespace={}): {}",
                        id, namespace, e.getMessage());
            }
        }
        return out;
    }

    private Draft infer(CausalChains.Chain chain, Map<String, MemoryNode> byId, MemoryNode anchor) {
        List<String> texts = chain.nodeIds().stream().map(id -> byId.get(id).text()).toList();
        String inference = completion.request("inference",
                List.of(Message.system(RelationPrompts.INFER_SYSTEM), Message.user(RelationPrompts.numbered(texts))),
                config.maxAttempts(),
                node -> LlmJson.requireText(LlmJson.requireObject(node), "inference"));

        Instant now = Instant.now();
        MemoryNode node = MemoryNode.builder()
                .id(UUID.randomUUID().toString())
                .text(inference)
                .embedding(embedder.embed(inference))
                .memoryType(anchor.memoryType())
                .confidence(chain.confidence())
                .background("Inferred from causal chain " + chain.nodeIds())
                .sources(chain.nodeIds().stream().map(SourceRef::node).toList())
                .createdAt(now)
                .updatedAt(now)
                .build();
        List<MemoryEdge> edges = chain.nodeIds().stream()
                .map(id -> new MemoryEdge(node.id(), id, RelationType.RELATED_TO, chain.confidence()))
                .toList();
        return new Draft(node, edges);
    }

    private Draft aggregate(List<MemoryNode> cluster, MemoryNode anchor) {
        record Summary(String key, String text, List<String> tags) {}
        Summary summary = completion.request("aggregate",
                List.of(Message.system(RelationPrompts.AGGREGATE_SYSTEM),
                        Message.user(RelationPrompts.numbered(cluster.stream().map(MemoryNode::text).toList()))),
                config.maxAttempts(),
                node -> {
                    LlmJson.requireObject(node);
                    return new Summary(LlmJson.optionalText(node, "key"),
                            LlmJson.requireText(node, "summary"),
                            LlmJson.stringList(node, "tags", false));
                });

        Instant now = Instant.now();
        MemoryNode node = MemoryNode.builder()
                .id(UUID.randomUUID().toString())
                .text(summary.text())
                .embedding(embedder.embed(summary.text()))
                .memoryType(anchor.memoryType())
                .key(summary.key())
                .tags(new LinkedHashSet<>(summary.tags()))
                .confidence(cluster.stream().mapToDouble(MemoryNode::confidence).min().orElse(1.0))
                .background("Aggregate of " + cluster.size() + " memories")
                .sources(cluster.stream().map(m -> SourceRef.node(m.id())).toList())
                .createdAt(now)
                .updatedAt(now)
                .build();
        List<MemoryEdge> edges = cluster.stream()
                .map(m -> MemoryEdge.of(node.id(), m.id(), RelationType.AGGREGATES))
                .toList();
        return new Draft(node, edges);
    }

    /** True when some node already aggregates every member of the cluster. */
    private boolean alreadyAggregated(List<MemoryNode> cluster, AtomicInteger failures, String namespace) {
        Set<String> ids = new HashSet<>();
        cluster.forEach(m -> ids.add(m.id()));
        try {
            List<MemoryNode> linked = guard.call("store", namespace, "traverse",
                    () -> store.traverse(cluster.get(0).id(), AGGREGATE, 1, namespace));
            return linked.stream().anyMatch(a -> a.isActive() && nodeSources(a).containsAll(ids));
        } catch (MemoryCoreException e) {
            failures.incrementAndGet();
            log.warn("[Reasoning] Could not check existing aggregates (namespace={}): {}", namespace, e.getMessage());
            return true;
        }
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    private List<MemoryEdge> writeEdges(List<MemoryEdge> edges, AtomicInteger failures, String namespace) {
        List<MemoryEdge> written = new ArrayList<>();
        for (MemoryEdge e : edges) {
            try {
                guard.run("store", namespace, "addEdge", () -> store.addEdge(e, namespace));
                written.add(e);
            } catch (MemoryCoreException ex) {
                failures.incrementAndGet();
                log.warn("[Reasoning] Dropped edge {} -{}-> {} (namespace={}): {}",
                        e.sourceId(), e.relationType(), e.targetId(), namespace, ex.getMessage());
            }
        }
        return written;
    }

    /** Each draft lands with all its edges or not at all. */
    private List<MemoryNode> writeDrafts(List<Draft> drafts, AtomicInteger failures, String namespace) {
        List<MemoryNode> written = new ArrayList<>();
        for (Draft d : drafts) {
            boolean aggregate = d.edges().stream().anyMatch(e -> e.relationType() == RelationType.AGGREGATES);
            if (aggregate && nodeSources(d.node()).size() < 2) {
                failures.incrementAndGet();
                continue;
            }
            try {
                guard.run("store", namespace, "addNode", () -> store.addNode(d.node(), namespace));
            } catch (MemoryCoreException e) {
                failures.incrementAndGet();
                log.warn("[Reasoning] Dropped synthesized node (namespace={}): {}", namespace, e.getMessage());
                continue;
            }
            try {
                for (MemoryEdge e : d.edges()) {
                    guard.run("store", namespace, "addEdge", () -> store.addEdge(e, namespace));
                }
                written.add(d.node());
            } catch (MemoryCoreException e) {
                failures.incrementAndGet();
                log.warn("[Reasoning] Edge write failed, removing synthesized node {} (namespace={}): {}",
                        d.node().id(), namespace, e.getMessage());
                compensate(d.node().id(), namespace);
            }
        }
        return written;
    }

    private void compensate(String nodeId, String namespace) {
        try {
            guard.run("store", namespace, "deleteNode", () -> store.deleteNode(nodeId, namespace));
        } catch (MemoryCoreException e) {
            log.error("[Reasoning] Could not remove orphaned node {} (namespace={}): {}",
                    nodeId, namespace, e.getMessage());
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private <T> List<T> runAll(List<Callable<T>> tasks, AtomicInteger failures, String what) {
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) futures.add(executor.submit(task));
        List<T> out = new ArrayList<>();
        try {
            for (Future<T> f : futures) {
                try {
                    T value = f.get();
                    if (value != null) out.add(value);
                } catch (ExecutionException e) {
                    failures.incrementAndGet();
                    log.warn("[Reasoning] {} dropped: {}", what, e.getCause() == null ? e : e.getCause().getMessage());
                }
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new CancellationException("ProcessNode cancelled during " + what + " stage");
        }
        return out;
    }

    private static Set<String> nodeSources(MemoryNode node) {
        Set<String> ids = new HashSet<>();
        for (SourceRef s : node.sources()) {
            if (s.kind() == SourceRef.Kind.NODE && s.nodeId() != null) ids.add(s.nodeId());
        }
        return ids;
    }

    /** Inferred and aggregate nodes list two or more NODE sources. */
    private static boolean synthesized(MemoryNode node) {
        return nodeSources(node).size() >= 2;
    }
}
