package com.openforge.memgraph.reasoning;

import java.util.List;

final class RelationPrompts {

    private RelationPrompts() {}

    static final String PAIR_SYSTEM = """
            You decide how two memory statements about the same person or topic relate.
            Allowed relations:
              "CAUSE"      - one statement is a cause of the other
              "FOLLOWS"    - one happened after the other as part of the same sequence of events
              "RELATED_TO" - clearly about the same subject but neither causal nor sequential
              "NONE"       - no meaningful relation
            For CAUSE and FOLLOWS give the direction: "A_TO_B" when A causes / precedes B, otherwise "B_TO_A".
            Reply with ONLY this JSON:
            {"relation": "CAUSE|FOLLOWS|RELATED_TO|NONE", "direction": "A_TO_B|B_TO_A", "confidence": 0.0-1.0}""";

    static final String PAIR_USER = """
            A: %s
            B: %s""";

    static final String INFER_SYSTEM = """
            You are given a chain of memory statements where each one causes the next.
            State in one sentence the new fact this chain implies that none of the statements says directly.
            Reply with ONLY this JSON: {"inference": "<one sentence>"}""";

    static final String AGGREGATE_SYSTEM = """
            You are given several memory statements that belong together.
            Write one concise summary covering all of them, a short key naming the shared topic,
            and up to five tags.
            Reply with ONLY this JSON: {"key": "<topic>", "summary": "<summary>", "tags": ["..."]}""";

    static String numbered(List<String> texts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < texts.size(); i++) {
            sb.append(i + 1).append(". ").append(texts.get(i)).append('\n');
        }
        return sb.toString();
    }
}
