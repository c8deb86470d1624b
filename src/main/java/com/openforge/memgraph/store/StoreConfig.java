package com.openforge.memgraph.store;

import com.openforge.memgraph.config.MemoryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default store backend. Backends are picked by memory.store.backend; each
 * backend owns one {@code @ConditionalOnProperty} configuration class.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "memory.store.backend", havingValue = "in-memory", matchIfMissing = true)
public class StoreConfig {

    @Bean
    public MemoryGraphStore inMemoryGraphStore(MemoryProperties props) {
        log.info("[Store] Using in-memory graph store (default dimension={}).",
                props.namespaces().defaultDimension());
        return new InMemoryGraphStore(props.namespaces());
    }
}
