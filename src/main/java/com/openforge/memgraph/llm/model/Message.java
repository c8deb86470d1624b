package com.openforge.memgraph.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A single entry in the LLM conversation.
 *
 * role variants:
 *   "system"    — instructions and output schema
 *   "user"      — the payload to analyse
 *   "assistant" — an earlier model reply (replayed when asking for a correction)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,
        String content
) {

    // ── Static factory helpers ──────────────────────────────────────────────

    public static Message system(String content) {
        return new Message("system", content);
    }

    public static Message user(String content) {
        return new Message("user", content);
    }

    public static Message assistant(String content) {
        return new Message("assistant", content);
    }
}
