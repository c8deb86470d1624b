package com.openforge.memgraph.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;

/**
 * Tuning knobs for the retrieval and consistency core.
 *
 * application.yml:
 *
 * memory:
 *   store:
 *     backend: in-memory          # or: milvus
 *   namespaces:
 *     default-dimension: 1536
 *     dimensions:
 *       tenant-a: 1024
 *   retrieval:
 *     vector-weight: 1.0
 *     keyword-boost: 0.15
 *     traversal-penalty: 0.1
 *     candidate-multiplier: 3
 *   consistency:
 *     top-k: 5
 *     fail-open: true
 *   reasoning:
 *     parallelism: 4
 *   timeouts:
 *     store-millis: 5000
 *   nli:
 *     backend: http               # or: llm
 *     base-url: http://localhost:32532
 */
@ConfigurationProperties(prefix = "memory")
public record MemoryProperties(
        @DefaultValue Store       store,
        @DefaultValue Namespaces  namespaces,
        @DefaultValue Retrieval   retrieval,
        @DefaultValue Consistency consistency,
        @DefaultValue Reasoning   reasoning,
        @DefaultValue Timeouts    timeouts,
        @DefaultValue Nli         nli
) {

    public static MemoryProperties defaults() {
        return new MemoryProperties(Store.defaults(), Namespaces.withDimension(1536),
                Retrieval.defaults(), Consistency.defaults(), Reasoning.defaults(),
                Timeouts.defaults(), Nli.defaults());
    }

    public MemoryProperties withNamespaces(Namespaces ns) {
        return new MemoryProperties(store, ns, retrieval, consistency, reasoning, timeouts, nli);
    }

    public MemoryProperties withConsistency(Consistency c) {
        return new MemoryProperties(store, namespaces, retrieval, c, reasoning, timeouts, nli);
    }

    public MemoryProperties withReasoning(Reasoning r) {
        return new MemoryProperties(store, namespaces, retrieval, consistency, r, timeouts, nli);
    }

    public record Store(
            @DefaultValue("in-memory") String backend
    ) {
        public static Store defaults() { return new Store("in-memory"); }
    }

    public record Namespaces(
            @DefaultValue("1536") int defaultDimension,
            Map<String, Integer>      dimensions
    ) {
        public static Namespaces withDimension(int dimension) {
            return new Namespaces(dimension, Map.of());
        }

        /** Embedding dimension every node in {@code namespace} must have. */
        public int dimensionFor(String namespace) {
            if (dimensions == null) return defaultDimension;
            return dimensions.getOrDefault(namespace, defaultDimension);
        }
    }

    /**
     * @param vectorWeight        multiplier on normalised vector similarity
     * @param keywordBoost        additive constant for any key/tag/text match
     * @param traversalPenalty    subtracted from the linked node's score for graph-sourced hits
     * @param candidateMultiplier vector stage fetches topK × this many candidates
     */
    public record Retrieval(
            @DefaultValue("1.0")  double vectorWeight,
            @DefaultValue("0.15") double keywordBoost,
            @DefaultValue("0.1")  double traversalPenalty,
            @DefaultValue("3")    int    candidateMultiplier
    ) {
        public static Retrieval defaults() { return new Retrieval(1.0, 0.15, 0.1, 3); }
    }

    /**
     * @param topK                  neighbours compared against a candidate
     * @param failOpen              commit on collaborator failure (false = reject the write)
     * @param mergeProvenance       append the candidate's sources to the duplicate it matched
     * @param consolidateDuplicates mark extra pre-existing duplicates MERGED into the first
     */
    public record Consistency(
            @DefaultValue("5")    int     topK,
            @DefaultValue("true") boolean failOpen,
            @DefaultValue("true") boolean mergeProvenance,
            @DefaultValue("true") boolean consolidateDuplicates
    ) {
        public static Consistency defaults() { return new Consistency(5, true, true, true); }
    }

    /**
     * @param parallelism        concurrent language-model calls per ProcessNode
     * @param maxInferences      inferred nodes produced per anchor at most
     * @param maxAggregates      aggregate nodes produced per anchor at most
     * @param maxAttempts        attempts per language-model call (malformed output or transport error)
     * @param reorganizeOnCommit submit ProcessNode after every committed write
     * @param topK               neighbours examined by the reorganizer
     */
    public record Reasoning(
            @DefaultValue("4")    int     parallelism,
            @DefaultValue("3")    int     maxInferences,
            @DefaultValue("2")    int     maxAggregates,
            @DefaultValue("2")    int     maxAttempts,
            @DefaultValue("true") boolean reorganizeOnCommit,
            @DefaultValue("5")    int     topK
    ) {
        public static Reasoning defaults() { return new Reasoning(4, 3, 2, 2, true, 5); }
    }

    public record Timeouts(
            @DefaultValue("5000") long storeMillis
    ) {
        public static Timeouts defaults() { return new Timeouts(5000); }
    }

    public record Nli(
            @DefaultValue("http")                   String backend,
            @DefaultValue("http://localhost:32532") String baseUrl,
            @DefaultValue("10")                     int    timeoutSeconds
    ) {
        public static Nli defaults() { return new Nli("http", "http://localhost:32532", 10); }
    }
}
