package com.openforge.memgraph.nli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memgraph.error.MalformedResponseException;
import com.openforge.memgraph.llm.LanguageModel;
import com.openforge.memgraph.llm.LlmJson;
import com.openforge.memgraph.llm.StructuredCompletion;
import com.openforge.memgraph.llm.model.Message;
import com.openforge.memgraph.model.NliResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * NLI through the language model, for deployments without an NLI server.
 * All targets are judged in one call.
 */
@Slf4j
public class LlmNliClassifier implements NliClassifier {

    private static final String SYSTEM = """
            You compare one SOURCE statement against numbered TARGET statements.
            For each target answer exactly one label:
              "Duplicate"     - the target states the same fact as the source
              "Contradiction" - the target and the source cannot both be true
              "Unrelated"     - anything else
            Reply with ONLY this JSON: {"results": ["<label>", ...]} with one label per target, in order.""";

    private static final int MAX_ATTEMPTS = 2;

    private final StructuredCompletion completion;

    public LlmNliClassifier(LanguageModel languageModel, ObjectMapper objectMapper) {
        this.completion = new StructuredCompletion(languageModel, objectMapper);
    }

    @Override
    public NliComparison compareOneToMany(String source, List<String> targets) {
        if (targets == null || targets.isEmpty()) return NliComparison.empty();

        StringBuilder prompt = new StringBuilder("SOURCE: ").append(source).append("\n");
        for (int i = 0; i < targets.size(); i++) {
            prompt.append("TARGET ").append(i + 1).append(": ").append(targets.get(i)).append("\n");
        }
        try {
            List<NliResult> results = completion.request("nli",
                    List.of(Message.system(SYSTEM), Message.user(prompt.toString())),
                    MAX_ATTEMPTS, node -> toResults(node, targets.size()));
            return NliComparison.of(results);
        } catch (RuntimeException e) {
            log.warn("[NLI] LLM classification failed, treating {} targets as Unrelated: {}",
                    targets.size(), e.getMessage());
            return NliComparison.fallback(targets.size(), e.getMessage());
        }
    }

    private static List<NliResult> toResults(JsonNode node, int expected) {
        JsonNode array = node.isArray() ? node : LlmJson.requireObject(node).get("results");
        if (array == null || !array.isArray()) {
            throw new MalformedResponseException("Missing 'results' array");
        }
        if (array.size() != expected) {
            throw new MalformedResponseException("Expected %d labels, got %d".formatted(expected, array.size()));
        }
        List<NliResult> out = new ArrayList<>(expected);
        for (JsonNode item : array) {
            if (!item.isTextual()) throw new MalformedResponseException("Label must be a string");
            out.add(NliResult.lookup(item.asText())
                    .orElseThrow(() -> new MalformedResponseException("Unknown label " + item)));
        }
        return out;
    }
}
