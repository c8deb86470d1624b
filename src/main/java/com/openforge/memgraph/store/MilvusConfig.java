package com.openforge.memgraph.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memgraph.config.MemoryProperties;
import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Milvus infrastructure beans, active when memory.store.backend=milvus.
 *
 * On startup:
 *   1. Creates a MilvusClientV2 connected to the configured host:port
 *   2. Ensures the edge collection and the default-dimension node collection exist
 *
 * Unlike the optional recall features this store backs every read and write,
 * so a failed connection aborts startup instead of silently disabling memory.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MilvusProperties.class)
@ConditionalOnProperty(name = "memory.store.backend", havingValue = "milvus")
public class MilvusConfig {

    @Bean(destroyMethod = "close")
    public MilvusClientV2 milvusClient(MilvusProperties props) {
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        try {
            MilvusClientV2 client = new MilvusClientV2(
                    ConnectConfig.builder()
                            .uri("http://%s:%d".formatted(props.host(), props.port()))
                            .connectTimeoutMs(props.connectTimeoutMs())
                            .build()
            );
            log.info("[Milvus] Connected successfully.");
            return client;
        } catch (Exception e) {
            throw new IllegalStateException("[Milvus] Connection to %s:%d failed: %s"
                    .formatted(props.host(), props.port(), e.getMessage()), e);
        }
    }

    @Bean
    public MilvusCollectionManager milvusCollectionManager(MilvusClientV2 milvusClient,
                                                           MilvusProperties props,
                                                           MemoryProperties memoryProps) {
        MilvusCollectionManager manager = new MilvusCollectionManager(milvusClient, props);
        manager.ensureEdgeCollection();
        manager.ensureNodeCollection(memoryProps.namespaces().defaultDimension());
        return manager;
    }

    @Bean
    public MemoryGraphStore milvusGraphStore(MilvusClientV2 milvusClient,
                                             MilvusCollectionManager collections,
                                             MilvusProperties props,
                                             MemoryProperties memoryProps,
                                             ObjectMapper objectMapper) {
        return new MilvusGraphStore(milvusClient, collections, memoryProps.namespaces(),
                objectMapper, props.queryLimit());
    }
}
