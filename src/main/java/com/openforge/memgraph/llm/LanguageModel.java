package com.openforge.memgraph.llm;

import com.openforge.memgraph.llm.model.Message;

import java.util.List;

/**
 * Prompt-in / text-out collaborator. Implementations apply their own timeouts
 * and throw {@link LlmClient.LlmException} when no provider could answer.
 */
public interface LanguageModel {

    String complete(List<Message> messages);
}
