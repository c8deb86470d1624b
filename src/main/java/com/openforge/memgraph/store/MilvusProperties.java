package com.openforge.memgraph.store;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection parameters for the Milvus vector database.
 *
 * application.yml:
 *
 * agent:
 *   milvus:
 *     host: localhost
 *     port: 19530
 *     node-collection-prefix: memory_nodes_
 *     edge-collection: memory_edges
 *
 * Nodes live in one collection per embedding dimension (memory_nodes_1536 …);
 * namespaces are a scalar field filtered on every request.
 */
@ConfigurationProperties(prefix = "agent.milvus")
public record MilvusProperties(
        @DefaultValue("localhost")     String host,
        @DefaultValue("19530")         int    port,
        @DefaultValue("15000")         long   connectTimeoutMs,
        @DefaultValue("memory_nodes_") String nodeCollectionPrefix,
        @DefaultValue("memory_edges")  String edgeCollection,
        @DefaultValue("1000")          int    queryLimit
) {}
