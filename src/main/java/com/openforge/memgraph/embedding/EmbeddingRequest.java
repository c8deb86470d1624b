package com.openforge.memgraph.embedding;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Request body for POST /v1/embeddings (OpenAI-compatible).
 *
 * Wire format:
 * {
 *   "input": ["first text", "second text"],
 *   "model": "text-embedding-3-small",
 *   "dimensions": 1536   // optional; only supported by text-embedding-3-*
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmbeddingRequest(
        List<String> input,
        String model,
        Integer dimensions
) {
    public static EmbeddingRequest of(List<String> input, String model, int dimensions) {
        return new EmbeddingRequest(input, model, dimensions > 0 ? dimensions : null);
    }
}
