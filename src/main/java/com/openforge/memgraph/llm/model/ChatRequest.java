package com.openforge.memgraph.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 *
 * Structured-output calls use a low temperature so repeated runs over the same
 * memories classify the same way.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        Double temperature,
        Integer maxTokens
) {

    /** Same request, addressed to {@code modelName}. */
    public ChatRequest withModel(String modelName) {
        return new ChatRequest(modelName, messages, temperature, maxTokens);
    }

    public static ChatRequest structured(String model, List<Message> messages) {
        return ChatRequest.builder()
                .model(model)
                .messages(messages)
                .temperature(0.1)
                .maxTokens(1024)
                .build();
    }
}
