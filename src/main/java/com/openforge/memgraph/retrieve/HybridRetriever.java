package com.openforge.memgraph.retrieve;

import com.openforge.memgraph.config.CollaboratorGuard;
import com.openforge.memgraph.config.MemoryProperties;
import com.openforge.memgraph.embedding.Embedder;
import com.openforge.memgraph.model.GoalType;
import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.model.MemoryType;
import com.openforge.memgraph.model.ParsedTaskGoal;
import com.openforge.memgraph.model.RelationType;
import com.openforge.memgraph.store.MemoryGraphStore;
import com.openforge.memgraph.store.StoreHit;
import com.openforge.memgraph.store.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Executes a {@link ParsedTaskGoal} against the memory graph.
 *
 * Stages:
 *   vector   — ANN search with the query embedding and every goal hint embedding
 *   keyword  — key / tag / text match of goal.keys + goal.tags, adds a fixed boost
 *   graph    — one hop over RELATED_TO / AGGREGATES from keyword-matched nodes
 *
 * Fused score = vectorWeight × clamp(similarity, 0, 1) + (keyword match ? keywordBoost : 0).
 * Graph-sourced nodes score their seed's score minus the traversal penalty.
 * A failing stage degrades the ranking instead of failing the call.
 */
@Slf4j
@Service
public class HybridRetriever {

    private static final Set<RelationType> CONTEXT_RELATIONS =
            EnumSet.of(RelationType.RELATED_TO, RelationType.AGGREGATES);

    private static final Comparator<ScoredNode> RANKING =
            Comparator.comparingDouble(ScoredNode::score).reversed()
                    .thenComparing(s -> s.node().updatedAt(),
                            Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                    .thenComparing(s -> s.node().id());

    private final MemoryGraphStore            store;
    private final Embedder                    embedder;
    private final CollaboratorGuard           guard;
    private final MemoryProperties.Retrieval  config;

    public HybridRetriever(MemoryGraphStore store,
                           Embedder embedder,
                           CollaboratorGuard guard,
                           MemoryProperties props) {
        this.store    = store;
        this.embedder = embedder;
        this.guard    = guard;
        this.config   = props.retrieval();
    }

    private static final class Candidate {
        final MemoryNode node;
        double  similarity;
        boolean vectorHit;
        boolean keywordHit;

        Candidate(MemoryNode node) {
            this.node = node;
        }
    }

    /**
     * @param queryEmbedding embedding of the query text; may be null when only hints should be searched
     * @param scope          memory tier to search; null searches every tier
     */
    public RetrievalResult retrieve(ParsedTaskGoal goal,
                                    @Nullable List<Float> queryEmbedding,
                                    @Nullable MemoryType scope,
                                    int topK,
                                    String namespace) {
        if (topK <= 0) return new RetrievalResult(List.of(), RetrievalStatus.NO_MATCHES, List.of());

        List<String> failed   = new ArrayList<>();
        int          attempted = 0;
        Map<String, Candidate> candidates = new LinkedHashMap<>();

        // ── Vector stage ─────────────────────────────────────────────────────
        List<List<Float>> probes = new ArrayList<>();
        if (queryEmbedding != null && !queryEmbedding.isEmpty()) probes.add(queryEmbedding);
        probes.addAll(hintEmbeddings(goal, namespace, failed));

        if (!probes.isEmpty()) {
            attempted++;
            int k = topK * Math.max(1, config.candidateMultiplier());
            try {
                for (List<Float> probe : probes) {
                    List<StoreHit> hits = guard.call("store", namespace, "vectorSearch",
                            () -> store.vectorSearch(probe, namespace, scope, k));
                    for (StoreHit hit : hits) {
                        Candidate c = candidates.computeIfAbsent(hit.node().id(), id -> new Candidate(hit.node()));
                        c.vectorHit  = true;
                        c.similarity = Math.max(c.similarity, hit.score());
                    }
                }
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("[Retriever] Vector stage failed (namespace={}, op=retrieve): {}", namespace, e.getMessage());
                failed.add("vector");
            }
        }
        checkCancelled();

        // ── Keyword stage ────────────────────────────────────────────────────
        List<String> terms = new ArrayList<>(goal.keys());
        terms.addAll(goal.tags());
        List<Candidate> seeds = new ArrayList<>();
        if (!terms.isEmpty()) {
            attempted++;
            try {
                List<MemoryNode> matched = guard.call("store", namespace, "keywordSearch",
                        () -> store.keywordSearch(terms, namespace, scope));
                for (MemoryNode node : matched) {
                    Candidate c = candidates.computeIfAbsent(node.id(), id -> new Candidate(node));
                    c.keywordHit = true;
                    for (List<Float> probe : probes) {
                        c.similarity = Math.max(c.similarity, VectorMath.cosine(probe, node.embedding()));
                    }
                    seeds.add(c);
                }
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("[Retriever] Keyword stage failed (namespace={}, op=retrieve): {}", namespace, e.getMessage());
                failed.add("keyword");
            }
        }
        checkCancelled();

        boolean vectorOrKeywordFailed = failed.contains("vector") || failed.contains("keyword");
        if (attempted > 0 && countStageFailures(failed) == attempted) {
            log.warn("[Retriever] All stages failed (namespace={}): {}", namespace, failed);
            return RetrievalResult.unavailable(failed);
        }

        // ── Fusion ───────────────────────────────────────────────────────────
        Map<String, ScoredNode> scored = new LinkedHashMap<>();
        for (Candidate c : candidates.values()) {
            if (!c.node.isActive()) continue;
            double score = config.vectorWeight() * clamp(c.similarity)
                    + (c.keywordHit ? config.keywordBoost() : 0.0);
            ScoredNode.Origin origin = c.vectorHit && c.keywordHit ? ScoredNode.Origin.HYBRID
                    : c.keywordHit ? ScoredNode.Origin.KEYWORD : ScoredNode.Origin.VECTOR;
            scored.put(c.node.id(), new ScoredNode(c.node, score, origin));
        }

        // ── Graph stage ──────────────────────────────────────────────────────
        boolean sparse = scored.size() < topK;
        boolean explicitKeys = goal.goalType() == GoalType.RETRIEVAL && !goal.keys().isEmpty();
        if ((sparse || explicitKeys) && !seeds.isEmpty()) {
            try {
                expandOverGraph(seeds, scored, scope, namespace);
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("[Retriever] Graph stage failed (namespace={}, op=retrieve): {}", namespace, e.getMessage());
                failed.add("graph");
            }
        }
        checkCancelled();

        List<ScoredNode> ranked = scored.values().stream().sorted(RANKING).limit(topK).toList();

        RetrievalStatus status;
        if (!failed.isEmpty())      status = RetrievalStatus.DEGRADED;
        else if (ranked.isEmpty())  status = RetrievalStatus.NO_MATCHES;
        else                        status = RetrievalStatus.OK;

        log.debug("[Retriever] ns={} scope={} candidates={} returned={} status={}{}",
                namespace, scope, candidates.size(), ranked.size(), status,
                vectorOrKeywordFailed ? " failed=" + failed : "");
        return new RetrievalResult(ranked, status, failed);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<List<Float>> hintEmbeddings(ParsedTaskGoal goal, String namespace, List<String> failed) {
        if (goal.memories().isEmpty()) return List.of();
        try {
            return embedder.embed(goal.memories());
        } catch (RuntimeException e) {
            log.warn("[Retriever] Could not embed {} goal hints (namespace={}): {}",
                    goal.memories().size(), namespace, e.getMessage());
            failed.add("hint-embedding");
            return List.of();
        }
    }

    private void expandOverGraph(List<Candidate> seeds, Map<String, ScoredNode> scored,
                                 @Nullable MemoryType scope, String namespace) {
        Map<String, ScoredNode> linked = new LinkedHashMap<>();
        for (Candidate seed : seeds) {
            ScoredNode seedScore = scored.get(seed.node.id());
            if (seedScore == null) continue;
            List<MemoryNode> neighbours = guard.call("store", namespace, "traverse",
                    () -> store.traverse(seed.node.id(), CONTEXT_RELATIONS, 1, namespace));
            for (MemoryNode n : neighbours) {
                if (!n.isActive() || scored.containsKey(n.id())) continue;
                if (scope != null && n.memoryType() != scope) continue;
                double score = seedScore.score() - config.traversalPenalty();
                linked.merge(n.id(), new ScoredNode(n, score, ScoredNode.Origin.GRAPH),
                        (a, b) -> a.score() >= b.score() ? a : b);
            }
        }
        scored.putAll(linked);
    }

    private static int countStageFailures(List<String> failed) {
        int n = 0;
        if (failed.contains("vector"))  n++;
        if (failed.contains("keyword")) n++;
        return n;
    }

    private static double clamp(double similarity) {
        return Math.max(0.0, Math.min(1.0, similarity));
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Retrieval cancelled");
        }
    }
}
