package com.openforge.memgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle tier of a memory node. Governs search scoping: every vector,
 * keyword and consistency lookup is restricted to one tier.
 *
 * WORKING_MEMORY    — recent facts extracted from the current conversation window.
 * LONG_TERM_MEMORY  — consolidated facts kept across sessions.
 * USER_MEMORY       — stable facts about the user (profile, preferences).
 */
public enum MemoryType {
    WORKING_MEMORY("WorkingMemory"),
    LONG_TERM_MEMORY("LongTermMemory"),
    USER_MEMORY("UserMemory");

    private final String label;

    MemoryType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Accepts both the wire label ("LongTermMemory") and the enum name. */
    @JsonCreator
    public static MemoryType fromLabel(String value) {
        for (MemoryType t : values()) {
            if (t.label.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value)) return t;
        }
        throw new IllegalArgumentException("Unknown memory type: " + value);
    }
}
