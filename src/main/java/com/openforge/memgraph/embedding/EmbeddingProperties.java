package com.openforge.memgraph.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the OpenAI-compatible text embedding endpoint.
 *
 * application.yml:
 *
 * agent:
 *   embedding:
 *     base-url: https://api.openai.com/v1
 *     api-key: ${EMBEDDING_API_KEY:sk-placeholder}
 *     model: text-embedding-3-small
 *     dimensions: 1536
 *     timeout-seconds: 30
 *
 * The dimension must match memory.namespaces.default-dimension (or the
 * namespace override) or the store rejects every write.
 */
@ConfigurationProperties(prefix = "agent.embedding")
public record EmbeddingProperties(
        String baseUrl,
        String apiKey,
        @DefaultValue("text-embedding-3-small") String model,
        @DefaultValue("1536") int dimensions,
        @DefaultValue("30") int timeoutSeconds
) {}
