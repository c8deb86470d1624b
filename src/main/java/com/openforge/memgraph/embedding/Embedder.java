package com.openforge.memgraph.embedding;

import java.util.List;

/**
 * Text → vector collaborator. One vector per input, same order, fixed dimension
 * per deployment.
 */
public interface Embedder {

    List<List<Float>> embed(List<String> texts);

    default List<Float> embed(String text) {
        return embed(List.of(text)).get(0);
    }
}
