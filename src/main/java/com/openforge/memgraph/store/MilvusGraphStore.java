package com.openforge.memgraph.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.openforge.memgraph.config.MemoryProperties;
import com.openforge.memgraph.error.NodeNotFoundException;
import com.openforge.memgraph.model.MemoryEdge;
import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.model.MemoryType;
import com.openforge.memgraph.model.NodeStatus;
import com.openforge.memgraph.model.RelationType;
import com.openforge.memgraph.model.SourceRef;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.QueryReq;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.QueryResp;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Milvus-backed graph store (memory.store.backend=milvus).
 *
 * Nodes and edges are plain rows; graph traversal is a breadth-first sequence of
 * scalar queries against the edge collection. Keyword matching uses Milvus
 * {@code like} expressions and is therefore case-sensitive.
 */
@Slf4j
public class MilvusGraphStore implements MemoryGraphStore {

    private static final List<String> NODE_FIELDS = List.of(
            "id", "namespace", "content", "memory_type", "key", "tags", "confidence",
            "background", "sources", "status", "created_at_ms", "updated_at_ms", "embedding");
    private static final List<String> EDGE_FIELDS = List.of(
            "edge_id", "source_id", "target_id", "relation_type", "confidence");

    private final MilvusClientV2              milvusClient;
    private final MilvusCollectionManager     collections;
    private final MemoryProperties.Namespaces namespaces;
    private final ObjectMapper                objectMapper;
    private final int                         queryLimit;

    public MilvusGraphStore(MilvusClientV2 milvusClient,
                            MilvusCollectionManager collections,
                            MemoryProperties.Namespaces namespaces,
                            ObjectMapper objectMapper,
                            int queryLimit) {
        this.milvusClient = milvusClient;
        this.collections  = collections;
        this.namespaces   = namespaces;
        this.objectMapper = objectMapper;
        this.queryLimit   = queryLimit;
    }

    private String nodeCollection(String namespace) {
        return collections.ensureNodeCollection(namespaces.dimensionFor(namespace));
    }

    // ── Nodes ────────────────────────────────────────────────────────────────

    @Override
    public void addNode(MemoryNode node, String namespace) {
        MemoryInvariants.checkNode(node, namespaces.dimensionFor(namespace));
        upsertNode(node, namespace);
        log.debug("[Milvus] Stored node {} ns={}", node.id(), namespace);
    }

    @Override
    public void updateNode(MemoryNode node, String namespace) {
        MemoryInvariants.checkNode(node, namespaces.dimensionFor(namespace));
        if (getNode(node.id(), namespace).isEmpty()) throw new NodeNotFoundException(node.id(), namespace);
        upsertNode(node, namespace);
    }

    private void upsertNode(MemoryNode node, String namespace) {
        milvusClient.upsert(UpsertReq.builder()
                .collectionName(nodeCollection(namespace))
                .data(List.of(toRow(node, namespace)))
                .build());
    }

    @Override
    public Optional<MemoryNode> getNode(String id, String namespace) {
        List<MemoryNode> found = queryNodes(namespace, "id == \"%s\"".formatted(escape(id)));
        return found.stream().findFirst();
    }

    @Override
    public void deleteNode(String id, String namespace) {
        milvusClient.delete(DeleteReq.builder()
                .collectionName(nodeCollection(namespace))
                .filter("namespace == \"%s\" and id == \"%s\"".formatted(escape(namespace), escape(id)))
                .build());
        milvusClient.delete(DeleteReq.builder()
                .collectionName(collections.ensureEdgeCollection())
                .filter("namespace == \"%s\" and (source_id == \"%s\" or target_id == \"%s\")"
                        .formatted(escape(namespace), escape(id), escape(id)))
                .build());
        log.info("[Milvus] Deleted node {} ns={}", id, namespace);
    }

    // ── Edges ────────────────────────────────────────────────────────────────

    @Override
    public void addEdge(MemoryEdge edge, String namespace) {
        MemoryInvariants.checkEdge(edge,
                getNode(edge.sourceId(), namespace).orElse(null),
                getNode(edge.targetId(), namespace).orElse(null));

        JsonObject row = new JsonObject();
        row.addProperty("edge_id", edge.sourceId() + "|" + edge.relationType().name() + "|" + edge.targetId());
        row.addProperty("namespace", namespace);
        row.addProperty("source_id", edge.sourceId());
        row.addProperty("target_id", edge.targetId());
        row.addProperty("relation_type", edge.relationType().name());
        row.addProperty("confidence", (float) edge.confidence());
        JsonArray marker = new JsonArray();
        marker.add(1.0f);
        marker.add(0.0f);
        row.add("marker", marker);

        milvusClient.upsert(UpsertReq.builder()
                .collectionName(collections.ensureEdgeCollection())
                .data(List.of(row))
                .build());
    }

    @Override
    public List<MemoryEdge> outgoingEdges(String nodeId, Set<RelationType> relationTypes, String namespace) {
        return queryEdges("namespace == \"%s\" and source_id == \"%s\" and relation_type in %s"
                .formatted(escape(namespace), escape(nodeId), typeList(relationTypes)));
    }

    // ── Search ───────────────────────────────────────────────────────────────

    @Override
    public List<StoreHit> vectorSearch(List<Float> embedding, String namespace, MemoryType scope, int k) {
        if (k <= 0) return List.of();
        SearchResp resp = milvusClient.search(SearchReq.builder()
                .collectionName(nodeCollection(namespace))
                .data(List.of(new FloatVec(embedding)))
                .annsField("embedding")
                .topK(k)
                .filter(scopeFilter(namespace, scope))
                .outputFields(NODE_FIELDS)
                .build());

        List<StoreHit> results = new ArrayList<>();
        if (resp == null || resp.getSearchResults() == null) return results;
        for (List<SearchResp.SearchResult> row : resp.getSearchResults()) {
            for (SearchResp.SearchResult hit : row) {
                Float s = hit.getScore();
                results.add(new StoreHit(fromEntity(hit.getEntity()), s == null ? 0.0 : s.doubleValue()));
            }
        }
        return results;
    }

    @Override
    public List<MemoryNode> keywordSearch(Collection<String> terms, String namespace, MemoryType scope) {
        List<String> clauses = terms.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> escape(t.trim()))
                .distinct()
                .map(t -> "content like \"%%%s%%\" or key like \"%%%s%%\" or tags like \"%%%s%%\""
                        .formatted(t, t, t))
                .toList();
        if (clauses.isEmpty()) return List.of();
        String filter = scopeFilter(namespace, scope) + " and (" + String.join(" or ", clauses) + ")";
        return queryNodes(namespace, filter);
    }

    @Override
    public List<MemoryNode> traverse(String nodeId, Set<RelationType> relationTypes, int depth, String namespace) {
        Set<String> visited = new LinkedHashSet<>(List.of(nodeId));
        Deque<String> frontier = new ArrayDeque<>(List.of(nodeId));
        for (int hop = 0; hop < depth && !frontier.isEmpty(); hop++) {
            String ids = idList(frontier);
            List<MemoryEdge> edges = queryEdges(
                    "namespace == \"%s\" and relation_type in %s and (source_id in %s or target_id in %s)"
                            .formatted(escape(namespace), typeList(relationTypes), ids, ids));
            Set<String> current = new LinkedHashSet<>(frontier);
            Deque<String> next = new ArrayDeque<>();
            for (MemoryEdge e : edges) {
                String other = current.contains(e.sourceId()) ? e.targetId() : e.sourceId();
                if (visited.add(other)) next.add(other);
            }
            frontier = next;
        }
        visited.remove(nodeId);
        if (visited.isEmpty()) return List.of();
        return queryNodes(namespace, "id in " + idList(visited));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<MemoryNode> queryNodes(String namespace, String filter) {
        String scoped = filter.startsWith("namespace ==") ? filter
                : "namespace == \"%s\" and (%s)".formatted(escape(namespace), filter);
        QueryResp resp = milvusClient.query(QueryReq.builder()
                .collectionName(nodeCollection(namespace))
                .filter(scoped)
                .outputFields(NODE_FIELDS)
                .limit(queryLimit)
                .build());
        List<MemoryNode> list = new ArrayList<>();
        if (resp == null || resp.getQueryResults() == null) return list;
        for (QueryResp.QueryResult r : resp.getQueryResults()) {
            list.add(fromEntity(r.getEntity()));
        }
        return list;
    }

    private List<MemoryEdge> queryEdges(String filter) {
        QueryResp resp = milvusClient.query(QueryReq.builder()
                .collectionName(collections.ensureEdgeCollection())
                .filter(filter)
                .outputFields(EDGE_FIELDS)
                .limit(queryLimit)
                .build());
        List<MemoryEdge> list = new ArrayList<>();
        if (resp == null || resp.getQueryResults() == null) return list;
        for (QueryResp.QueryResult r : resp.getQueryResults()) {
            Map<String, Object> e = r.getEntity();
            list.add(new MemoryEdge(str(e, "source_id"), str(e, "target_id"),
                    RelationType.valueOf(str(e, "relation_type")), num(e, "confidence")));
        }
        return list;
    }

    private JsonObject toRow(MemoryNode node, String namespace) {
        JsonObject row = new JsonObject();
        row.addProperty("id", node.id());
        row.addProperty("namespace", namespace);
        row.addProperty("content", node.text());
        row.addProperty("memory_type", node.memoryType().name());
        row.addProperty("key", node.key() == null ? "" : truncate(node.key(), 500));
        JsonArray tags = new JsonArray();
        node.tags().forEach(tags::add);
        row.addProperty("tags", tags.toString());
        row.addProperty("confidence", (float) node.confidence());
        row.addProperty("background", node.background() == null ? "" : truncate(node.background(), 1000));
        row.addProperty("sources", writeSources(node.sources()));
        row.addProperty("status", node.status().name());
        row.addProperty("created_at_ms", millis(node.createdAt()));
        row.addProperty("updated_at_ms", millis(node.updatedAt()));
        JsonArray embeddingArray = new JsonArray();
        for (Float f : node.embedding()) embeddingArray.add(f);
        row.add("embedding", embeddingArray);
        return row;
    }

    @SuppressWarnings("unchecked")
    private MemoryNode fromEntity(Map<String, Object> e) {
        Set<String> tags = new LinkedHashSet<>();
        String rawTags = str(e, "tags");
        if (!rawTags.isBlank()) {
            for (JsonElement t : JsonParser.parseString(rawTags).getAsJsonArray()) tags.add(t.getAsString());
        }
        Object vector = e.get("embedding");
        return MemoryNode.builder()
                .id(str(e, "id"))
                .text(str(e, "content"))
                .embedding(vector instanceof List<?> list ? (List<Float>) list : null)
                .memoryType(MemoryType.valueOf(str(e, "memory_type")))
                .key(blankToNull(str(e, "key")))
                .tags(tags)
                .confidence(num(e, "confidence"))
                .background(blankToNull(str(e, "background")))
                .sources(readSources(str(e, "sources")))
                .status(NodeStatus.valueOf(str(e, "status")))
                .createdAt(instant(e, "created_at_ms"))
                .updatedAt(instant(e, "updated_at_ms"))
                .build();
    }

    private String writeSources(List<SourceRef> sources) {
        try {
            return objectMapper.writeValueAsString(sources);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialise sources", ex);
        }
    }

    private List<SourceRef> readSources(String raw) {
        if (raw == null || raw.isBlank()) return List.of();
        try {
            return objectMapper.readValue(raw, new TypeReference<List<SourceRef>>() {});
        } catch (JsonProcessingException ex) {
            log.warn("[Milvus] Unreadable sources column, treating as empty: {}", ex.getMessage());
            return List.of();
        }
    }

    private static String scopeFilter(String namespace, MemoryType scope) {
        String filter = "namespace == \"%s\"".formatted(escape(namespace));
        return scope == null ? filter : filter + " and memory_type == \"%s\"".formatted(scope.name());
    }

    private static String typeList(Set<RelationType> types) {
        return types.stream().map(t -> "\"" + t.name() + "\"").collect(Collectors.joining(", ", "[", "]"));
    }

    private static String idList(Collection<String> ids) {
        return ids.stream().map(id -> "\"" + escape(id) + "\"").collect(Collectors.joining(", ", "[", "]"));
    }

    private static String escape(String raw) {
        return raw.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static long millis(Instant instant) {
        return instant == null ? 0L : instant.toEpochMilli();
    }

    private static Instant instant(Map<String, Object> e, String key) {
        long ms = ((Number) e.getOrDefault(key, 0L)).longValue();
        return ms > 0 ? Instant.ofEpochMilli(ms) : null;
    }

    private static String str(Map<String, Object> e, String key) {
        Object v = e.get(key);
        return v == null ? "" : v.toString();
    }

    private static double num(Map<String, Object> e, String key) {
        return ((Number) e.getOrDefault(key, 0f)).doubleValue();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    private static String truncate(String text, int maxLen) {
        return text.length() > maxLen ? text.substring(0, maxLen) : text;
    }
}
