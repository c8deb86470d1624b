package com.openforge.memgraph.goal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memgraph.model.GoalType;
import com.openforge.memgraph.model.ParsedTaskGoal;
import com.openforge.memgraph.support.ScriptedLanguageModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TaskGoalParserTest {

    private static final String TASK = "When did Caroline go to the LGBTQ support group?";

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void fastModeReadsKeysTagsAndType() {
        ScriptedLanguageModel model = new ScriptedLanguageModel().when(TASK, """
                {"keys": ["Caroline", "LGBTQ support group"], "tags": ["event"], "goal_type": "retrieval"}""");

        ParsedTaskGoal goal = new TaskGoalParser(model, mapper).parse(TASK, ParseMode.FAST);

        assertThat(goal.keys()).containsExactly("Caroline", "LGBTQ support group");
        assertThat(goal.tags()).containsExactly("event");
        assertThat(goal.goalType()).isEqualTo(GoalType.RETRIEVAL);
        assertThat(goal.memories()).containsExactly(TASK);
        assertThat(goal.rephrasedQuery()).isNull();
    }

    @Test
    void fineModeKeepsMemoriesAndRephrasedQuery() {
        ScriptedLanguageModel model = new ScriptedLanguageModel().when(TASK, """
                Here you go:
                ```json
                {"memories": ["Caroline joined an LGBTQ support group"],
                 "keys": ["Caroline"], "tags": [], "goal_type": "summary",
                 "rephrased_query": "Date Caroline first attended the LGBTQ support group"}
                ```""");

        ParsedTaskGoal goal = new TaskGoalParser(model, mapper).parse(TASK, ParseMode.FINE, "we talked about Caroline");

        assertThat(goal.memories()).containsExactly("Caroline joined an LGBTQ support group");
        assertThat(goal.goalType()).isEqualTo(GoalType.SUMMARY);
        assertThat(goal.rephrasedQuery()).isEqualTo("Date Caroline first attended the LGBTQ support group");
        assertThat(model.calls().get(0).get(1).content()).contains("we talked about Caroline");
    }

    @Test
    void malformedReplyIsRetriedOnceWithCorrection() {
        ScriptedLanguageModel model = new ScriptedLanguageModel()
                .when(TASK, "I think the keys are Caroline")
                .when("could not be used", """
                        {"keys": ["Caroline"], "goal_type": "retrieval"}""");

        ParsedTaskGoal goal = new TaskGoalParser(model, mapper).parse(TASK, ParseMode.FAST);

        assertThat(goal.keys()).containsExactly("Caroline");
        assertThat(model.calls()).hasSize(2);
        assertThat(model.calls().get(1)).extracting(m -> m.role())
                .containsExactly("system", "user", "assistant", "user");
    }

    @Test
    void fallsBackToMinimalGoalAfterTwoBadReplies() {
        ScriptedLanguageModel model = new ScriptedLanguageModel().otherwise(m -> "not json at all");

        ParsedTaskGoal goal = new TaskGoalParser(model, mapper).parse(TASK, ParseMode.FAST);

        assertThat(goal).isEqualTo(ParsedTaskGoal.fallback(TASK));
        assertThat(model.calls()).hasSize(2);
    }

    @Test
    void fineModeRejectsEmptyMemories() {
        ScriptedLanguageModel model = new ScriptedLanguageModel().otherwise(m -> """
                {"memories": [], "keys": ["Caroline"]}""");

        ParsedTaskGoal goal = new TaskGoalParser(model, mapper).parse(TASK, ParseMode.FINE);

        assertThat(goal.memories()).containsExactly(TASK);
        assertThat(goal.keys()).isEmpty();
    }

    @Test
    void unknownGoalTypeBecomesRetrieval() {
        ScriptedLanguageModel model = new ScriptedLanguageModel().otherwise(m -> """
                {"keys": ["Caroline"], "goal_type": "gossip"}""");

        assertThat(new TaskGoalParser(model, mapper).parse(TASK, ParseMode.FAST).goalType())
                .isEqualTo(GoalType.RETRIEVAL);
    }

    @Test
    void modelOutageYieldsMinimalGoal() {
        ScriptedLanguageModel model = new ScriptedLanguageModel().otherwise(m -> {
            throw new IllegalStateException("connection refused");
        });

        ParsedTaskGoal goal = new TaskGoalParser(model, mapper).parse(TASK, ParseMode.FINE);

        assertThat(goal.memories()).isEqualTo(List.of(TASK));
        assertThat(goal.goalType()).isEqualTo(GoalType.RETRIEVAL);
    }
}
