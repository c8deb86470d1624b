package com.openforge.memgraph.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - collaboratorExecutor  → runs time-limited store calls and HTTP client I/O
 *  - reasoningExecutor     → bounded pool for per-pair language-model calls
 *  - reorganizerExecutor   → single thread running ProcessNode after commits
 *  - Java HttpClient       → the ONLY HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper  → snake_case ↔ camelCase, Java time, tolerant deserialization
 */
@Configuration
@EnableConfigurationProperties(MemoryProperties.class)
public class AppConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService collaboratorExecutor() {
        return Executors.newCachedThreadPool(named("memgraph-io-"));
    }

    /** Sized to the language-model provider's rate limit via memory.reasoning.parallelism. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService reasoningExecutor(MemoryProperties props) {
        return Executors.newFixedThreadPool(Math.max(1, props.reasoning().parallelism()),
                named("memgraph-reason-"));
    }

    /** Kept apart from reasoningExecutor: a ProcessNode run blocks on tasks it submits there. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService reorganizerExecutor() {
        return Executors.newSingleThreadExecutor(named("memgraph-reorg-"));
    }

    /**
     * Single, shared HttpClient instance.
     * 30 s connect timeout; per-request read timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient(ExecutorService collaboratorExecutor) {
        return HttpClient.newBuilder()
                .executor(collaboratorExecutor)
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper configured for OpenAI-compatible JSON:
     *  - snake_case property names (finish_reason, goal_type …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (API can add fields without breaking us)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
