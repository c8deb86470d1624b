package com.openforge.memgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/** Intent behind a free-text query. */
public enum GoalType {
    RETRIEVAL,
    UPDATE,
    SUMMARY;

    /** Lenient lookup for model output; anything unrecognised is a retrieval. */
    @JsonCreator
    public static GoalType lenient(String value) {
        if (value == null) return RETRIEVAL;
        for (GoalType t : values()) {
            if (t.name().equalsIgnoreCase(value.trim())) return t;
        }
        return RETRIEVAL;
    }
}
