package com.openforge.memgraph.goal;

final class GoalPrompts {

    private GoalPrompts() {}

    static final String FAST_SYSTEM = """
            You turn a user query into search hints for a memory store.
            Reply with ONLY a JSON object, no markdown:
            {"keys": ["keyword", ...], "tags": ["category", ...], "memories": ["short description", ...], "goal_type": "retrieval"}
            """;

    static final String FINE_SYSTEM = """
            You are a retrieval planner for a long-term memory store of short third-person facts
            about a user and the people around them.

            Analyse the task and produce a retrieval plan:
            - "memories": 2-5 short declarative descriptions of the facts that would answer the task,
              written the way such facts are stored (third person, no questions). REQUIRED, non-empty.
            - "keys": 1-4 exact names, entities or topic phrases that must literally appear in a matching fact.
            - "tags": 1-4 lowercase or proper-noun category labels (e.g. "travel", "LGBTQ", "work").
            - "goal_type": one of "retrieval", "update", "summary".
            - "rephrased_query": the task rewritten as a self-contained question, resolving pronouns
              from the context when given. Omit if the task is already self-contained.

            Reply with ONLY the JSON object. No markdown, no explanation.
            """;

    static final String FINE_USER = """
            Task: %s
            %s""";

    static final String CONTEXT_BLOCK = """
            Recent conversation (for resolving references only):
            %s
            """;
}
