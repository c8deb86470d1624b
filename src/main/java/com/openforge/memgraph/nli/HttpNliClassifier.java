package com.openforge.memgraph.nli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memgraph.config.MemoryProperties;
import com.openforge.memgraph.error.MalformedResponseException;
import com.openforge.memgraph.model.NliResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the NLI model server.
 *
 * POST {baseUrl}/compare_one_to_many
 *   request:  {"source": "...", "targets": ["...", ...]}
 *   response: ["Duplicate", "Contradiction", ...]  or  {"results": [...]}
 *
 * A transport error, a non-2xx status, an unreadable body or a label outside the three
 * verdicts yields an all-UNRELATED comparison carrying the error message.
 */
@Slf4j
public class HttpNliClassifier implements NliClassifier {

    private final HttpClient     httpClient;
    private final ObjectMapper   objectMapper;
    private final String         endpoint;
    private final Duration       timeout;

    public HttpNliClassifier(HttpClient httpClient, ObjectMapper objectMapper, MemoryProperties.Nli props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.endpoint     = stripTrailingSlash(props.baseUrl()) + "/compare_one_to_many";
        this.timeout      = Duration.ofSeconds(props.timeoutSeconds());
    }

    @Override
    public NliComparison compareOneToMany(String source, List<String> targets) {
        if (targets == null || targets.isEmpty()) return NliComparison.empty();

        HttpResponse<String> response;
        try {
            String body = objectMapper.writeValueAsString(Map.of("source", source, "targets", targets));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .header("Content-Type", "application/json")
                    .timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            log.debug("[NLI] → POST {} targets={}", endpoint, targets.size());
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(targets.size(), "interrupted");
        } catch (IOException e) {
            return failure(targets.size(), "network error: " + e.getMessage());
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            return failure(targets.size(), "HTTP %d: %s".formatted(response.statusCode(), response.body()));
        }
        try {
            List<NliResult> results = parse(response.body());
            if (results.size() != targets.size()) {
                return failure(targets.size(), "server returned %d verdicts for %d targets"
                        .formatted(results.size(), targets.size()));
            }
            return NliComparison.of(results);
        } catch (JsonProcessingException e) {
            return failure(targets.size(), "unreadable response: " + e.getOriginalMessage());
        } catch (MalformedResponseException e) {
            return failure(targets.size(), e.getMessage());
        }
    }

    private List<NliResult> parse(String body) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(body);
        JsonNode array = root.isArray() ? root : root.path("results");
        List<NliResult> out = new ArrayList<>();
        if (!array.isArray()) return out;
        for (JsonNode item : array) {
            Optional<NliResult> verdict = item.isTextual() ? NliResult.lookup(item.asText()) : Optional.empty();
            if (verdict.isEmpty()) throw new MalformedResponseException("unknown label " + item);
            out.add(verdict.get());
        }
        return out;
    }

    private static NliComparison failure(int size, String error) {
        log.warn("[NLI] compare_one_to_many failed, treating {} targets as Unrelated: {}", size, error);
        return NliComparison.fallback(size, error);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
