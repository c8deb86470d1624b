package com.openforge.memgraph.llm.model;

import java.util.List;

/**
 * The parts of a /chat/completions reply the core reads: the first choice's message
 * and token usage for debug logging. Unknown fields are ignored by the shared mapper.
 */
public record ChatResponse(
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** First choice's text; empty when the provider sent no choice or no content. */
    public String content() {
        if (choices == null || choices.isEmpty() || choices.get(0).message() == null) return "";
        String text = choices.get(0).message().content();
        return text == null ? "" : text;
    }

    /** -1 when the provider did not report usage. */
    public int totalTokens() {
        return usage == null ? -1 : usage.totalTokens();
    }

    public record Choice(Message message, String finishReason) {}

    public record Usage(int promptTokens, int completionTokens, int totalTokens) {}
}
