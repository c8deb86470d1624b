package com.openforge.memgraph.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Pure-Java embedding client — zero SDK dependency.
 *
 * Calls the OpenAI-compatible /embeddings endpoint with a batch of inputs and
 * returns one float vector per input, in input order.
 *
 * Same transport as {@link com.openforge.memgraph.llm.LlmClient}: the shared HttpClient and Jackson.
 */
@Slf4j
@Component
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingClient implements Embedder {

    private static final int MAX_INPUT_CHARS = 8000;

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;

    public EmbeddingClient(HttpClient httpClient,
                           ObjectMapper objectMapper,
                           EmbeddingProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Embed a batch of texts.
     *
     * @param texts non-blank texts; each is trimmed to a safe length for model token limits
     * @return one vector per text, length = {@link EmbeddingProperties#dimensions()}
     */
    @Override
    public List<List<Float>> embed(List<String> texts) {
        if (texts.isEmpty()) return List.of();
        if (texts.stream().anyMatch(t -> t == null || t.isBlank())) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }
        List<String> input = texts.stream()
                .map(t -> t.length() > MAX_INPUT_CHARS ? t.substring(0, MAX_INPUT_CHARS) : t)
                .toList();

        String body = serialize(EmbeddingRequest.of(input, props.model(), props.dimensions()));
        log.debug("[Embed] → POST /embeddings model={} inputs={}", props.model(), input.size());

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/embeddings"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + props.apiKey())
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted calling embedding API", e);
        } catch (IOException e) {
            throw new EmbeddingException("Network error calling embedding API", e);
        }

        List<List<Float>> vectors = parseResponse(response);
        if (vectors.size() != input.size()) {
            throw new EmbeddingException("Embedding API returned %d vectors for %d inputs"
                    .formatted(vectors.size(), input.size()));
        }
        return vectors;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<List<Float>> parseResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();

        if (status == 429) throw new EmbeddingException("Embedding API rate-limited");
        if (status < 200 || status >= 300)
            throw new EmbeddingException("Embedding API returned HTTP %d: %s".formatted(status, body));

        try {
            EmbeddingResponse resp = objectMapper.readValue(body, EmbeddingResponse.class);
            List<List<Float>> vectors = resp.orderedEmbeddings();
            log.debug("[Embed] ← {} vectors dim={}", vectors.size(), vectors.get(0).size());
            return vectors;
        } catch (JsonProcessingException | IllegalStateException e) {
            throw new EmbeddingException("Failed to parse embedding response: " + body, e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize embedding request", e);
        }
    }

    // ── Exception ────────────────────────────────────────────────────────────

    public static class EmbeddingException extends RuntimeException {
        public EmbeddingException(String message) { super(message); }
        public EmbeddingException(String message, Throwable cause) { super(message, cause); }
    }
}
