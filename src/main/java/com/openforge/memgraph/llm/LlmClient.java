package com.openforge.memgraph.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memgraph.llm.model.ChatRequest;
import com.openforge.memgraph.llm.model.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Blocking chat calls to one OpenAI-compatible provider. Owned by {@link LlmRouter};
 * resilience lives there, so every failure here is simply thrown as {@link LlmException}.
 */
@Slf4j
public class LlmClient {

    private final HttpClient                   httpClient;
    private final ObjectMapper                 objectMapper;
    private final LlmProperties.ProviderConfig config;
    private final URI                          endpoint;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
        this.endpoint     = URI.create(config.baseUrl() + "/chat/completions");
    }

    public ChatResponse chat(ChatRequest request) {
        ChatRequest effective = request.model() == null || request.model().isBlank()
                ? request.withModel(config.model())
                : request;
        String body;
        try {
            body = objectMapper.writeValueAsString(effective);
        } catch (JsonProcessingException e) {
            throw new LlmException("Could not serialize chat request for [%s]".formatted(config.name()), e);
        }
        log.debug("[LlmClient:{}] POST {} messages={}", config.name(), effective.model(),
                effective.messages().size());

        HttpRequest httpRequest = HttpRequest.newBuilder(endpoint)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted calling [%s]".formatted(config.name()), e);
        } catch (IOException e) {
            throw new LlmException("Network error calling [%s]: %s".formatted(config.name(), e.getMessage()), e);
        }
        return read(response);
    }

    /** The model name configured for this provider. */
    public String modelName() {
        return config.model();
    }

    private ChatResponse read(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 429) {
            throw new LlmRateLimitException("Rate-limited by [%s]".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            throw new LlmException("[%s] returned HTTP %d: %s".formatted(config.name(), status, response.body()));
        }
        try {
            return objectMapper.readValue(response.body(), ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException("Unreadable chat response from [%s]".formatted(config.name()), e);
        }
    }

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    /** HTTP 429; retried like any other {@link LlmException}. */
    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }
}
