package com.openforge.memgraph.support;

import com.openforge.memgraph.config.CollaboratorGuard;
import com.openforge.memgraph.config.MemoryProperties;
import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.model.MemoryType;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ExecutorService;

public final class TestFixtures {

    public static final String NS = "tenant-a";

    private TestFixtures() {}

    public static MemoryProperties props() {
        return MemoryProperties.defaults()
                .withNamespaces(MemoryProperties.Namespaces.withDimension(HashingEmbedder.DIMENSION));
    }

    public static CollaboratorGuard guard(ExecutorService executor) {
        TimeLimiter limiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofSeconds(5))
                .cancelRunningFuture(true)
                .build());
        return new CollaboratorGuard(limiter, executor);
    }

    /** Long-term node embedded with {@code embedder}, updated at {@code epochSecond}. */
    public static MemoryNode node(HashingEmbedder embedder, String id, String text, long epochSecond) {
        return MemoryNode.builder()
                .id(id)
                .text(text)
                .embedding(embedder.embed(text))
                .memoryType(MemoryType.LONG_TERM_MEMORY)
                .tags(Set.of())
                .confidence(0.9)
                .createdAt(Instant.ofEpochSecond(epochSecond))
                .updatedAt(Instant.ofEpochSecond(epochSecond))
                .build();
    }
}
