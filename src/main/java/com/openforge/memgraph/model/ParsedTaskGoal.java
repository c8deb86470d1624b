package com.openforge.memgraph.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Structured retrieval intent derived from a free-text query. Produced fresh
 * for every query and never persisted.
 *
 * @param memories       semantic descriptions used as soft retrieval hints
 * @param keys           keywords for exact / near-exact matching
 * @param tags           categorical filters
 * @param goalType       RETRIEVAL / UPDATE / SUMMARY
 * @param rephrasedQuery optional self-contained rewrite of the query; null when absent
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParsedTaskGoal(
        List<String> memories,
        List<String> keys,
        List<String> tags,
        GoalType     goalType,
        String       rephrasedQuery
) {

    public ParsedTaskGoal {
        memories = memories == null ? List.of() : List.copyOf(memories);
        keys     = keys == null ? List.of() : List.copyOf(keys);
        tags     = tags == null ? List.of() : List.copyOf(tags);
        goalType = goalType == null ? GoalType.RETRIEVAL : goalType;
    }

    /** Minimal goal used whenever the model output cannot be trusted. */
    public static ParsedTaskGoal fallback(String task) {
        return new ParsedTaskGoal(List.of(task), List.of(), List.of(), GoalType.RETRIEVAL, null);
    }

    public boolean hasKeywords() {
        return !keys.isEmpty() || !tags.isEmpty();
    }
}
