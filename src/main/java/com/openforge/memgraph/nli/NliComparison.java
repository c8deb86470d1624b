package com.openforge.memgraph.nli;

import com.openforge.memgraph.model.NliResult;

import java.util.Collections;
import java.util.List;

/**
 * @param results one verdict per target, same order
 * @param error   why some or all verdicts are fallbacks; null on success
 */
public record NliComparison(List<NliResult> results, String error) {

    public NliComparison {
        results = List.copyOf(results);
    }

    public static NliComparison empty() {
        return new NliComparison(List.of(), null);
    }

    public static NliComparison of(List<NliResult> results) {
        return new NliComparison(results, null);
    }

    /** Every target UNRELATED, with the failure recorded. */
    public static NliComparison fallback(int size, String error) {
        return new NliComparison(Collections.nCopies(size, NliResult.UNRELATED), error);
    }

    public boolean failed() {
        return error != null;
    }
}
