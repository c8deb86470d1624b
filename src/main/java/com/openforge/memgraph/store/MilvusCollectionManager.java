package com.openforge.memgraph.store;

import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manages Milvus collection lifecycle at runtime.
 *
 * Node collections are created on demand, one per embedding dimension, because
 * namespaces may be configured with different dimensions. The edge collection is
 * shared; Milvus requires a vector field in every collection, so edges carry a
 * constant 2-d placeholder vector that is never searched.
 *
 * Node collection schema (memory_nodes_{dim}):
 * ┌──────────────────┬─────────────────┬─────────────────────────────────────┐
 * │ Field            │ Type            │ Notes                               │
 * ├──────────────────┼─────────────────┼─────────────────────────────────────┤
 * │ id               │ VARCHAR(64) PK  │ caller-assigned                     │
 * │ namespace        │ VARCHAR(128)    │ tenant / cube                       │
 * │ content          │ VARCHAR(16000)  │ fact text, UTF-8 bytes              │
 * │ memory_type      │ VARCHAR(32)     │ MemoryType name                     │
 * │ key              │ VARCHAR(512)    │ topic label                         │
 * │ tags             │ VARCHAR(2048)   │ JSON array                          │
 * │ confidence       │ FLOAT           │ 0.0 – 1.0                           │
 * │ background       │ VARCHAR(1024)   │ provenance string                   │
 * │ sources          │ VARCHAR(8192)   │ JSON array of SourceRef             │
 * │ status           │ VARCHAR(32)     │ ACTIVATED / ARCHIVED / MERGED       │
 * │ created_at_ms    │ INT64           │ epoch millis                        │
 * │ updated_at_ms    │ INT64           │ epoch millis                        │
 * │ embedding        │ FLOAT_VECTOR    │ dim = namespace dimension           │
 * └──────────────────┴─────────────────┴─────────────────────────────────────┘
 */
@Slf4j
public class MilvusCollectionManager {

    static final int PLACEHOLDER_DIM = 2;
    /** Milvus VARCHAR limits are in bytes; four per char covers any UTF-8 text. */
    static final int CONTENT_MAX_BYTES = MemoryInvariants.MAX_TEXT_LENGTH * 4;

    private final MilvusClientV2   milvusClient;
    private final MilvusProperties props;

    /** In-memory cache of collection names we know already exist. */
    private final Set<String> existingCollections = ConcurrentHashMap.newKeySet();

    public MilvusCollectionManager(MilvusClientV2 milvusClient, MilvusProperties props) {
        this.milvusClient = milvusClient;
        this.props        = props;
    }

    public String nodeCollectionName(int dimension) {
        return props.nodeCollectionPrefix() + dimension;
    }

    public String edgeCollectionName() {
        return props.edgeCollection();
    }

    /** Ensures the node collection for {@code dimension} exists and returns its name. */
    public String ensureNodeCollection(int dimension) {
        String name = nodeCollectionName(dimension);
        if (existingCollections.contains(name)) return name;
        if (milvusClient.hasCollection(HasCollectionReq.builder().collectionName(name).build())) {
            existingCollections.add(name);
            log.info("[Milvus] Collection '{}' confirmed existing.", name);
            return name;
        }
        log.info("[Milvus] Creating node collection '{}' (dim={})…", name, dimension);

        CreateCollectionReq.CollectionSchema schema = CreateCollectionReq.CollectionSchema.builder().build();
        schema.addField(AddFieldReq.builder().fieldName("id")
                .dataType(DataType.VarChar).maxLength(64).isPrimaryKey(true).autoID(false).build());
        schema.addField(varchar("namespace", 128));
        schema.addField(varchar("content", CONTENT_MAX_BYTES));
        schema.addField(varchar("memory_type", 32));
        schema.addField(varchar("key", 512));
        schema.addField(varchar("tags", 2048));
        schema.addField(AddFieldReq.builder().fieldName("confidence").dataType(DataType.Float).build());
        schema.addField(varchar("background", 1024));
        schema.addField(varchar("sources", 8192));
        schema.addField(varchar("status", 32));
        schema.addField(AddFieldReq.builder().fieldName("created_at_ms").dataType(DataType.Int64).build());
        schema.addField(AddFieldReq.builder().fieldName("updated_at_ms").dataType(DataType.Int64).build());
        schema.addField(AddFieldReq.builder().fieldName("embedding")
                .dataType(DataType.FloatVector).dimension(dimension).build());

        // IP (Inner Product) ≈ cosine similarity for L2-normalised embeddings.
        IndexParam vectorIndex = IndexParam.builder()
                .fieldName("embedding")
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.IP)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();
        IndexParam namespaceIndex = IndexParam.builder()
                .fieldName("namespace")
                .indexType(IndexParam.IndexType.TRIE)
                .build();

        milvusClient.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex, namespaceIndex))
                .build());
        existingCollections.add(name);
        log.info("[Milvus] Collection '{}' created successfully.", name);
        return name;
    }

    public String ensureEdgeCollection() {
        String name = edgeCollectionName();
        if (existingCollections.contains(name)) return name;
        if (milvusClient.hasCollection(HasCollectionReq.builder().collectionName(name).build())) {
            existingCollections.add(name);
            return name;
        }
        log.info("[Milvus] Creating edge collection '{}'…", name);

        CreateCollectionReq.CollectionSchema schema = CreateCollectionReq.CollectionSchema.builder().build();
        schema.addField(AddFieldReq.builder().fieldName("edge_id")
                .dataType(DataType.VarChar).maxLength(256).isPrimaryKey(true).autoID(false).build());
        schema.addField(varchar("namespace", 128));
        schema.addField(varchar("source_id", 64));
        schema.addField(varchar("target_id", 64));
        schema.addField(varchar("relation_type", 32));
        schema.addField(AddFieldReq.builder().fieldName("confidence").dataType(DataType.Float).build());
        schema.addField(AddFieldReq.builder().fieldName("marker")
                .dataType(DataType.FloatVector).dimension(PLACEHOLDER_DIM).build());

        IndexParam markerIndex = IndexParam.builder()
                .fieldName("marker")
                .indexType(IndexParam.IndexType.FLAT)
                .metricType(IndexParam.MetricType.L2)
                .build();
        IndexParam sourceIndex = IndexParam.builder()
                .fieldName("source_id")
                .indexType(IndexParam.IndexType.TRIE)
                .build();

        milvusClient.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(markerIndex, sourceIndex))
                .build());
        existingCollections.add(name);
        log.info("[Milvus] Edge collection '{}' created.", name);
        return name;
    }

    private static AddFieldReq varchar(String field, int maxLength) {
        return AddFieldReq.builder().fieldName(field).dataType(DataType.VarChar).maxLength(maxLength).build();
    }
}
