package com.openforge.memgraph.store;

import com.openforge.memgraph.config.MemoryProperties;
import com.openforge.memgraph.error.NodeNotFoundException;
import com.openforge.memgraph.model.MemoryEdge;
import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.model.MemoryType;
import com.openforge.memgraph.model.RelationType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Heap-resident store: one partition per namespace, exact cosine search.
 *
 * Default backend (memory.store.backend=in-memory). Suitable for tests and
 * single-process deployments; contents are lost on restart.
 */
@Slf4j
public class InMemoryGraphStore implements MemoryGraphStore {

    private final MemoryProperties.Namespaces namespaces;
    private final Map<String, Partition>      partitions = new ConcurrentHashMap<>();

    public InMemoryGraphStore(MemoryProperties.Namespaces namespaces) {
        this.namespaces = namespaces;
    }

    private static final class Partition {
        final Map<String, MemoryNode> nodes = new ConcurrentHashMap<>();
        final List<MemoryEdge>        edges = new CopyOnWriteArrayList<>();
    }

    private Partition partition(String namespace) {
        return partitions.computeIfAbsent(namespace, ns -> new Partition());
    }

    // ── Nodes ────────────────────────────────────────────────────────────────

    @Override
    public void addNode(MemoryNode node, String namespace) {
        MemoryInvariants.checkNode(node, namespaces.dimensionFor(namespace));
        partition(namespace).nodes.put(node.id(), node);
        log.debug("[Store] add node {} ns={}", node.id(), namespace);
    }

    @Override
    public void updateNode(MemoryNode node, String namespace) {
        MemoryInvariants.checkNode(node, namespaces.dimensionFor(namespace));
        MemoryNode previous = partition(namespace).nodes.computeIfPresent(node.id(), (id, old) -> node);
        if (previous == null) throw new NodeNotFoundException(node.id(), namespace);
    }

    @Override
    public Optional<MemoryNode> getNode(String id, String namespace) {
        return Optional.ofNullable(partition(namespace).nodes.get(id));
    }

    @Override
    public void deleteNode(String id, String namespace) {
        Partition p = partition(namespace);
        p.nodes.remove(id);
        p.edges.removeIf(e -> e.sourceId().equals(id) || e.targetId().equals(id));
    }

    // ── Edges ────────────────────────────────────────────────────────────────

    @Override
    public void addEdge(MemoryEdge edge, String namespace) {
        Partition p = partition(namespace);
        MemoryInvariants.checkEdge(edge, p.nodes.get(edge.sourceId()), p.nodes.get(edge.targetId()));
        synchronized (p.edges) {
            p.edges.removeIf(e -> e.sourceId().equals(edge.sourceId())
                    && e.targetId().equals(edge.targetId())
                    && e.relationType() == edge.relationType());
            p.edges.add(edge);
        }
    }

    @Override
    public List<MemoryEdge> outgoingEdges(String nodeId, Set<RelationType> relationTypes, String namespace) {
        return partition(namespace).edges.stream()
                .filter(e -> e.sourceId().equals(nodeId) && relationTypes.contains(e.relationType()))
                .toList();
    }

    // ── Search ───────────────────────────────────────────────────────────────

    @Override
    public List<StoreHit> vectorSearch(List<Float> embedding, String namespace, MemoryType scope, int k) {
        return partition(namespace).nodes.values().stream()
                .filter(n -> scope == null || n.memoryType() == scope)
                .map(n -> new StoreHit(n, VectorMath.cosine(embedding, n.embedding())))
                .sorted(Comparator.comparingDouble(StoreHit::score).reversed())
                .limit(Math.max(0, k))
                .toList();
    }

    @Override
    public List<MemoryNode> keywordSearch(Collection<String> terms, String namespace, MemoryType scope) {
        List<String> needles = terms.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.toLowerCase(Locale.ROOT).trim())
                .distinct()
                .toList();
        if (needles.isEmpty()) return List.of();
        return partition(namespace).nodes.values().stream()
                .filter(n -> scope == null || n.memoryType() == scope)
                .filter(n -> needles.stream().anyMatch(t -> matches(n, t)))
                .toList();
    }

    private static boolean matches(MemoryNode node, String needle) {
        if (node.key() != null && node.key().toLowerCase(Locale.ROOT).contains(needle)) return true;
        for (String tag : node.tags()) {
            if (tag.toLowerCase(Locale.ROOT).contains(needle)) return true;
        }
        return node.text().toLowerCase(Locale.ROOT).contains(needle);
    }

    @Override
    public List<MemoryNode> traverse(String nodeId, Set<RelationType> relationTypes, int depth, String namespace) {
        Partition p = partition(namespace);
        Set<String> visited = new LinkedHashSet<>();
        visited.add(nodeId);
        Deque<String> frontier = new ArrayDeque<>(List.of(nodeId));
        for (int hop = 0; hop < depth && !frontier.isEmpty(); hop++) {
            Deque<String> next = new ArrayDeque<>();
            for (String current : frontier) {
                for (MemoryEdge e : p.edges) {
                    if (!relationTypes.contains(e.relationType())) continue;
                    String other = e.sourceId().equals(current) ? e.targetId()
                            : e.targetId().equals(current) ? e.sourceId() : null;
                    if (other != null && visited.add(other)) next.add(other);
                }
            }
            frontier = next;
        }
        List<MemoryNode> reached = new ArrayList<>();
        for (String id : visited) {
            if (id.equals(nodeId)) continue;
            MemoryNode n = p.nodes.get(id);
            if (n != null) reached.add(n);
        }
        return reached;
    }
}
