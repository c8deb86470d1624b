package com.openforge.memgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Pairwise natural-language-inference verdict between a source text and a target text.
 * Wire values match the NLI service ("Duplicate", "Contradiction", "Unrelated").
 */
public enum NliResult {
    DUPLICATE("Duplicate"),
    CONTRADICTION("Contradiction"),
    UNRELATED("Unrelated");

    private final String value;

    NliResult(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Matches the wire value or the constant name, ignoring case; empty for anything else. */
    public static Optional<NliResult> lookup(String raw) {
        if (raw == null) return Optional.empty();
        String label = raw.trim();
        for (NliResult r : values()) {
            if (r.value.equalsIgnoreCase(label) || r.name().equalsIgnoreCase(label)) return Optional.of(r);
        }
        return Optional.empty();
    }

    @JsonCreator
    public static NliResult fromValue(String raw) {
        return lookup(raw).orElseThrow(() -> new IllegalArgumentException("Unknown NLI label: " + raw));
    }
}
