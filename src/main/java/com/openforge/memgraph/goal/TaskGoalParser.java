package com.openforge.memgraph.goal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memgraph.error.MalformedResponseException;
import com.openforge.memgraph.llm.LanguageModel;
import com.openforge.memgraph.llm.LlmJson;
import com.openforge.memgraph.llm.StructuredCompletion;
import com.openforge.memgraph.llm.model.Message;
import com.openforge.memgraph.model.GoalType;
import com.openforge.memgraph.model.ParsedTaskGoal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns a free-text query into a {@link ParsedTaskGoal}.
 *
 * Never fails the caller: a malformed reply is retried once with a corrective
 * instruction, after which (or on any model outage) the minimal goal
 * {@code memories=[task], goal_type=RETRIEVAL} is returned. Goals are not cached.
 */
@Slf4j
@Service
public class TaskGoalParser {

    /** First call plus one corrective retry. */
    private static final int MAX_ATTEMPTS = 2;

    private final StructuredCompletion completion;

    public TaskGoalParser(LanguageModel languageModel, ObjectMapper objectMapper) {
        this.completion = new StructuredCompletion(languageModel, objectMapper);
    }

    public ParsedTaskGoal parse(String task, ParseMode mode) {
        return parse(task, mode, null);
    }

    /**
     * @param context recent conversation used by FINE mode to resolve references; ignored by FAST
     */
    public ParsedTaskGoal parse(String task, ParseMode mode, @Nullable String context) {
        if (task == null || task.isBlank()) {
            return ParsedTaskGoal.fallback(task == null ? "" : task);
        }
        List<Message> messages = mode == ParseMode.FAST
                ? List.of(Message.system(GoalPrompts.FAST_SYSTEM), Message.user(task))
                : List.of(Message.system(GoalPrompts.FINE_SYSTEM),
                          Message.user(GoalPrompts.FINE_USER.formatted(task,
                                  context == null || context.isBlank() ? "" : GoalPrompts.CONTEXT_BLOCK.formatted(context))));
        try {
            ParsedTaskGoal goal = completion.request("goal-" + mode.name().toLowerCase(), messages, MAX_ATTEMPTS,
                    node -> toGoal(node, task, mode));
            log.debug("[GoalParser] {} → memories={} keys={} tags={} type={}",
                    mode, goal.memories().size(), goal.keys(), goal.tags(), goal.goalType());
            return goal;
        } catch (MalformedResponseException e) {
            log.warn("[GoalParser] {} mode fell back to minimal goal: {}", mode, e.getMessage());
            return ParsedTaskGoal.fallback(task);
        } catch (RuntimeException e) {
            log.warn("[GoalParser] Language model unavailable ({}), using minimal goal.", e.getMessage());
            return ParsedTaskGoal.fallback(task);
        }
    }

    private static ParsedTaskGoal toGoal(JsonNode node, String task, ParseMode mode) {
        LlmJson.requireObject(node);
        List<String> memories = LlmJson.stringList(node, "memories", mode == ParseMode.FINE);
        if (mode == ParseMode.FINE && memories.isEmpty()) {
            throw new MalformedResponseException("Field 'memories' must not be empty");
        }
        List<String> keys = LlmJson.stringList(node, "keys", false);
        List<String> tags = LlmJson.stringList(node, "tags", false);
        if (mode == ParseMode.FAST && memories.isEmpty() && keys.isEmpty() && tags.isEmpty()) {
            throw new MalformedResponseException("Reply contains no keys, tags or memories");
        }
        return ParsedTaskGoal.builder()
                .memories(memories.isEmpty() ? List.of(task) : memories)
                .keys(keys)
                .tags(tags)
                .goalType(GoalType.lenient(LlmJson.optionalText(node, "goal_type")))
                .rephrasedQuery(mode == ParseMode.FINE ? LlmJson.optionalText(node, "rephrased_query") : null)
                .build();
    }
}
