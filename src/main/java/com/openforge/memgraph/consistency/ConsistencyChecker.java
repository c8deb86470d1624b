package com.openforge.memgraph.consistency;

import com.openforge.memgraph.config.CollaboratorGuard;
import com.openforge.memgraph.config.MemoryProperties;
import com.openforge.memgraph.embedding.Embedder;
import com.openforge.memgraph.error.CollaboratorUnavailableException;
import com.openforge.memgraph.error.InvariantViolationException;
import com.openforge.memgraph.model.GoalType;
import com.openforge.memgraph.model.MemoryEdge;
import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.model.NliResult;
import com.openforge.memgraph.model.NodeStatus;
import com.openforge.memgraph.model.ParsedTaskGoal;
import com.openforge.memgraph.model.RelationType;
import com.openforge.memgraph.model.SourceRef;
import com.openforge.memgraph.nli.NliClassifier;
import com.openforge.memgraph.nli.NliComparison;
import com.openforge.memgraph.retrieve.HybridRetriever;
import com.openforge.memgraph.retrieve.RetrievalResult;
import com.openforge.memgraph.retrieve.RetrievalStatus;
import com.openforge.memgraph.store.MemoryGraphStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Pre-write consistency check: adjust perspective → embed → retrieve neighbours in the
 * same memory tier → NLI → decide.
 *
 * Any Duplicate wins over any Contradiction. A contradicting write is still committed,
 * next to a CONTRADICTS edge, and the existing node's text is never modified.
 * The committed node carries the adjusted text; the raw message text is kept on its
 * MESSAGE source.
 *
 * Not safe to call concurrently for the same namespace; callers go through
 * {@link NamespaceWriteGate}.
 */
@Slf4j
@Service
public class ConsistencyChecker {

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "with", "that", "this", "was", "were", "are", "has", "have", "had",
            "his", "her", "him", "himself", "herself", "she", "they", "them", "their", "its", "not",
            "but", "from", "into", "about", "what", "when", "where", "who", "which", "how", "did",
            "does", "every", "also", "very", "just", "user", "assistant");

    private final MemoryGraphStore             store;
    private final Embedder                     embedder;
    private final HybridRetriever              retriever;
    private final NliClassifier                nli;
    private final PerspectiveAdjuster          adjuster;
    private final CollaboratorGuard            guard;
    private final MemoryProperties.Consistency config;

    public ConsistencyChecker(MemoryGraphStore store,
                              Embedder embedder,
                              HybridRetriever retriever,
                              NliClassifier nli,
                              PerspectiveAdjuster adjuster,
                              CollaboratorGuard guard,
                              MemoryProperties props) {
        this.store     = store;
        this.embedder  = embedder;
        this.retriever = retriever;
        this.nli       = nli;
        this.adjuster  = adjuster;
        this.guard     = guard;
        this.config    = props.consistency();
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * @throws CollaboratorUnavailableException when the candidate cannot be embedded or stored at all
     * @throws InvariantViolationException      when the node itself is invalid for the namespace,
     *                                          or its caller-assigned id is already taken
     */
    public WriteOutcome checkAndCommit(MemoryNode candidate, String namespace) {
        String requestedId = candidate.id();
        if (requestedId != null && !requestedId.isBlank()
                && guard.call("store", namespace, "getNode", () -> store.getNode(requestedId, namespace)).isPresent()) {
            throw new InvariantViolationException("Node %s already exists in namespace %s"
                    .formatted(requestedId, namespace));
        }
        String adjusted = adjuster.adjust(candidate);
        MemoryNode node = prepare(candidate, adjusted, namespace);

        // ── Neighbours ───────────────────────────────────────────────────────
        ParsedTaskGoal lookup = ParsedTaskGoal.builder()
                .keys(keywords(node))
                .tags(List.copyOf(node.tags()))
                .goalType(GoalType.UPDATE)
                .build();
        RetrievalResult retrieved = retriever.retrieve(lookup, node.embedding(), node.memoryType(),
                config.topK(), namespace);
        if (retrieved.status() == RetrievalStatus.UNAVAILABLE) {
            return onCheckFailure(node, namespace, "retrieval unavailable " + retrieved.failedStages());
        }
        List<MemoryNode> neighbours = retrieved.nodes();
        if (neighbours.isEmpty()) {
            return commit(node, namespace, retrieved.isDegraded());
        }

        // ── Classification ───────────────────────────────────────────────────
        NliComparison comparison = nli.compareOneToMany(adjusted,
                neighbours.stream().map(MemoryNode::text).toList());
        if (comparison.failed()) {
            return onCheckFailure(node, namespace, "NLI: " + comparison.error());
        }

        List<MemoryNode> duplicates     = new ArrayList<>();
        List<MemoryNode> contradictions = new ArrayList<>();
        for (int i = 0; i < neighbours.size(); i++) {
            NliResult verdict = comparison.results().get(i);
            if (verdict == NliResult.DUPLICATE)     duplicates.add(neighbours.get(i));
            if (verdict == NliResult.CONTRADICTION) contradictions.add(neighbours.get(i));
        }

        // ── Decision ─────────────────────────────────────────────────────────
        if (!duplicates.isEmpty()) {
            return skipDuplicate(node, duplicates, namespace);
        }
        if (!contradictions.isEmpty()) {
            return flag(node, contradictions.get(0), namespace);
        }
        return commit(node, namespace, retrieved.isDegraded());
    }

    // ── Decisions ────────────────────────────────────────────────────────────

    private WriteOutcome commit(MemoryNode node, String namespace, boolean unchecked) {
        guard.run("store", namespace, "addNode", () -> store.addNode(node, namespace));
        log.info("[Consistency] Committed {} (namespace={}{})", node.id(), namespace,
                unchecked ? ", check incomplete" : "");
        return WriteOutcome.committed(node.id(), unchecked);
    }

    private WriteOutcome skipDuplicate(MemoryNode node, List<MemoryNode> duplicates, String namespace) {
        MemoryNode primary = duplicates.get(0);
        List<String> merged = new ArrayList<>();
        if (config.mergeProvenance()) {
            MemoryNode updated = primary.toBuilder()
                    .sources(union(primary.sources(), node.sources()))
                    .updatedAt(Instant.now())
                    .build();
            try {
                guard.run("store", namespace, "updateNode", () -> store.updateNode(updated, namespace));
            } catch (CollaboratorUnavailableException | InvariantViolationException e) {
                log.warn("[Consistency] Provenance merge into {} failed (namespace={}): {}",
                        primary.id(), namespace, e.getMessage());
            }
        }
        if (config.consolidateDuplicates()) {
            for (MemoryNode extra : duplicates.subList(1, duplicates.size())) {
                List<SourceRef> sources = new ArrayList<>(extra.sources());
                sources.add(SourceRef.successor(primary.id()));
                MemoryNode retired = extra.toBuilder()
                        .status(NodeStatus.MERGED)
                        .sources(sources)
                        .updatedAt(Instant.now())
                        .build();
                try {
                    guard.run("store", namespace, "updateNode", () -> store.updateNode(retired, namespace));
                    merged.add(extra.id());
                } catch (CollaboratorUnavailableException | InvariantViolationException e) {
                    log.warn("[Consistency] Could not merge duplicate {} into {} (namespace={}): {}",
                            extra.id(), primary.id(), namespace, e.getMessage());
                }
            }
        }
        log.info("[Consistency] Skipped duplicate of {} (namespace={}, merged={})",
                primary.id(), namespace, merged);
        return WriteOutcome.duplicate(primary.id(), merged);
    }

    private WriteOutcome flag(MemoryNode node, MemoryNode conflicting, String namespace) {
        guard.run("store", namespace, "addNode", () -> store.addNode(node, namespace));
        MemoryEdge edge = MemoryEdge.of(node.id(), conflicting.id(), RelationType.CONTRADICTS);
        try {
            guard.run("store", namespace, "addEdge", () -> store.addEdge(edge, namespace));
        } catch (CollaboratorUnavailableException | InvariantViolationException e) {
            log.warn("[Consistency] Flagged {} but could not record CONTRADICTS edge to {} (namespace={}): {}",
                    node.id(), conflicting.id(), namespace, e.getMessage());
        }
        log.info("[Consistency] Flagged {} as contradicting {} (namespace={})",
                node.id(), conflicting.id(), namespace);
        return WriteOutcome.flagged(node.id(), conflicting.id());
    }

    private WriteOutcome onCheckFailure(MemoryNode node, String namespace, String reason) {
        if (config.failOpen()) {
            log.warn("[Consistency] Check failed, committing unchecked (namespace={}, op=checkAndCommit): {}",
                    namespace, reason);
            return commit(node, namespace, true);
        }
        log.warn("[Consistency] Check failed, rejecting write (namespace={}, op=checkAndCommit): {}",
                namespace, reason);
        return WriteOutcome.rejected();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /** Assigns id and timestamps, swaps in the adjusted text and embeds it when needed. */
    private MemoryNode prepare(MemoryNode candidate, String adjusted, String namespace) {
        boolean rewritten = !adjusted.equals(candidate.text());
        List<Float> embedding = candidate.embedding();
        if (embedding == null || embedding.isEmpty() || rewritten) {
            try {
                embedding = embedder.embed(adjusted);
            } catch (RuntimeException e) {
                log.warn("[Consistency] Could not embed candidate (namespace={}, op=checkAndCommit): {}",
                        namespace, e.getMessage());
                throw new CollaboratorUnavailableException("embedder", namespace, "checkAndCommit", e);
            }
        }
        Instant now = Instant.now();
        return candidate.toBuilder()
                .id(candidate.id() == null || candidate.id().isBlank() ? UUID.randomUUID().toString() : candidate.id())
                .text(adjusted)
                .embedding(embedding)
                .sources(rewritten ? keepRawText(candidate) : candidate.sources())
                .status(NodeStatus.ACTIVATED)
                .createdAt(candidate.createdAt() == null ? now : candidate.createdAt())
                .updatedAt(candidate.updatedAt() == null ? now : candidate.updatedAt())
                .build();
    }

    /** Stores the pre-adjustment text on the originating message when it carries none. */
    private static List<SourceRef> keepRawText(MemoryNode candidate) {
        List<SourceRef> out = new ArrayList<>();
        boolean done = false;
        for (SourceRef s : candidate.sources()) {
            if (!done && s.kind() == SourceRef.Kind.MESSAGE && s.content() == null) {
                out.add(SourceRef.message(s.role(), s.lang(), candidate.text()));
                done = true;
            } else {
                out.add(s);
            }
        }
        return out;
    }

    private static List<SourceRef> union(List<SourceRef> existing, List<SourceRef> added) {
        Set<SourceRef> all = new LinkedHashSet<>(existing);
        all.addAll(added);
        return List.copyOf(all);
    }

    /** The node's key plus content words of its text. */
    static List<String> keywords(MemoryNode node) {
        Set<String> out = new LinkedHashSet<>();
        if (node.key() != null && !node.key().isBlank()) out.add(node.key().trim());
        for (String token : node.text().toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() < 3 || STOPWORDS.contains(token)) continue;
            if (PerspectiveAdjuster.detectLanguage(token).equals("zh")) continue;
            out.add(token);
        }
        return List.copyOf(out);
    }
}
