package com.openforge.memgraph.nli;

import java.util.List;

/**
 * Pairwise NLI between one source text and many targets.
 *
 * Implementations never throw for classification failures: entries that could not be
 * classified come back as UNRELATED and the failure is reported in {@link NliComparison#error()}.
 * An empty target list returns an empty comparison without any remote call.
 */
public interface NliClassifier {

    NliComparison compareOneToMany(String source, List<String> targets);
}
