package com.openforge.memgraph.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memgraph.llm.model.ChatRequest;
import com.openforge.memgraph.llm.model.ChatResponse;
import com.openforge.memgraph.llm.model.Message;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.List;
import java.util.function.Supplier;

/**
 * The {@link LanguageModel} behind goal parsing, relation classification, aggregate
 * summaries and LLM-backed NLI.
 *
 * Each structured call tries the primary provider, then the fallback. A provider is
 * wrapped in its own circuit breaker around its own retry, so an open primary breaker
 * sends calls straight to the fallback. When both routes give up, the caller gets an
 * {@link LlmClient.LlmException}; every caller in the core maps that to a degraded
 * result rather than a failed write.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter implements LanguageModel {

    /** One provider with its own breaker and retry. */
    private record Route(String label, LlmClient client, CircuitBreaker breaker, Retry retry) {

        ChatResponse send(ChatRequest request) {
            ChatRequest pinned = request.withModel(client.modelName());
            Supplier<ChatResponse> call = CircuitBreaker.decorateSupplier(breaker,
                    Retry.decorateSupplier(retry, () -> client.chat(pinned)));
            return call.get();
        }
    }

    private final Route primary;
    private final Route fallback;

    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this.primary  = new Route("primary", new LlmClient(httpClient, objectMapper, properties.primary()),
                primaryLlmCircuitBreaker, primaryLlmRetry);
        this.fallback = new Route("fallback", new LlmClient(httpClient, objectMapper, properties.fallback()),
                fallbackLlmCircuitBreaker, fallbackLlmRetry);
    }

    /** Low-temperature completion; returns the first choice's text, empty when the provider sent none. */
    @Override
    public String complete(List<Message> messages) {
        ChatResponse response = chat(ChatRequest.structured(null, messages));
        log.debug("[LlmRouter] {} answered, tokens={}", response.model(), response.totalTokens());
        return response.content();
    }

    /** The request's model is replaced by each provider's configured one. */
    public ChatResponse chat(ChatRequest request) {
        try {
            return primary.send(request);
        } catch (RuntimeException primaryFailure) {
            log.warn("[LlmRouter] {} provider failed ({}), trying {}: {}", primary.label(),
                    primaryFailure.getClass().getSimpleName(), fallback.label(), primaryFailure.getMessage());
        }
        try {
            return fallback.send(request);
        } catch (RuntimeException fallbackFailure) {
            throw new LlmClient.LlmException("[LlmRouter] Both providers failed, last error from fallback: %s"
                    .formatted(fallbackFailure.getMessage()), fallbackFailure);
        }
    }
}
