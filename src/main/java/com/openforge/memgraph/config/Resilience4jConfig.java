package com.openforge.memgraph.config;

import com.openforge.memgraph.llm.LlmClient;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j instances for the two collaborators the core cannot trust.
 *
 * The language model gets a circuit breaker and a retry per provider ("primaryLlm",
 * "fallbackLlm"), used by {@link com.openforge.memgraph.llm.LlmRouter}. The graph store
 * gets a TimeLimiter ("store") that {@link CollaboratorGuard} puts around every store call,
 * with its timeout taken from memory.timeouts.store-millis.
 */
@Configuration
public class Resilience4jConfig {

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // open after half of the last 10 structured calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                // a structured reply slower than 60 s counts as a failure
                .slowCallDurationThreshold(Duration.ofSeconds(60))
                .slowCallRateThreshold(80)
                // two trial calls while half-open
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(LlmClient.LlmException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker("primaryLlm");
        registry.circuitBreaker("fallbackLlm");
        return registry;
    }

    @Bean
    public CircuitBreaker primaryLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("primaryLlm");
    }

    @Bean
    public CircuitBreaker fallbackLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("fallbackLlm");
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(500), 2.0))
                // a bad JSON payload inside a good reply is StructuredCompletion's job, not a retry
                .retryOnException(e -> e instanceof LlmClient.LlmException)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry("primaryLlm");
        registry.retry("fallbackLlm");
        return registry;
    }

    @Bean
    public Retry primaryLlmRetry(RetryRegistry registry) {
        return registry.retry("primaryLlm");
    }

    @Bean
    public Retry fallbackLlmRetry(RetryRegistry registry) {
        return registry.retry("fallbackLlm");
    }

    // ── Time limiter ─────────────────────────────────────────────────────────

    @Bean
    public TimeLimiter storeTimeLimiter(MemoryProperties props) {
        return TimeLimiter.of("store", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(props.timeouts().storeMillis()))
                .cancelRunningFuture(true)
                .build());
    }
}
