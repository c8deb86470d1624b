package com.openforge.memgraph.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memgraph.error.MalformedResponseException;
import com.openforge.memgraph.llm.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Language-model call that must yield a schema-valid JSON document.
 *
 * On a schema mismatch the rejected reply is replayed together with a corrective
 * instruction, up to {@code maxAttempts} calls in total. Transport failures
 * ({@link LlmClient.LlmException}) are not retried here; the router already did.
 */
@Slf4j
public class StructuredCompletion {

    private static final String CORRECTION = """
            Your previous reply could not be used: %s
            Reply again with ONLY the JSON document in the exact shape requested. No markdown, no explanation.""";

    private final LanguageModel model;
    private final ObjectMapper  objectMapper;

    public StructuredCompletion(LanguageModel model, ObjectMapper objectMapper) {
        this.model        = model;
        this.objectMapper = objectMapper;
    }

    /**
     * @param label  short name for logs ("goal", "relation" …)
     * @param schema maps the parsed document to a value; throws MalformedResponseException on mismatch
     */
    public <T> T request(String label, List<Message> messages, int maxAttempts,
                         Function<JsonNode, T> schema) {
        List<Message> conversation = new ArrayList<>(messages);
        MalformedResponseException last = null;
        for (int attempt = 1; attempt <= Math.max(1, maxAttempts); attempt++) {
            String raw = model.complete(conversation);
            try {
                return schema.apply(LlmJson.parse(objectMapper, raw));
            } catch (MalformedResponseException e) {
                last = e;
                log.debug("[LLM:{}] attempt {} rejected: {}", label, attempt, e.getMessage());
                conversation.add(Message.assistant(raw == null ? "" : raw));
                conversation.add(Message.user(CORRECTION.formatted(e.getMessage())));
            }
        }
        throw new MalformedResponseException("[%s] no valid JSON after %d attempts: %s"
                .formatted(label, Math.max(1, maxAttempts), last.getMessage()), last);
    }
}
