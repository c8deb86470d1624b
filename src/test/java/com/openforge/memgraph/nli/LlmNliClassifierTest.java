package com.openforge.memgraph.nli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memgraph.model.NliResult;
import com.openforge.memgraph.support.ScriptedLanguageModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LlmNliClassifierTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void oneCallJudgesEveryTarget() {
        ScriptedLanguageModel model = new ScriptedLanguageModel()
                .when("SOURCE", "{\"results\": [\"Unrelated\", \"Duplicate\"]}");

        NliComparison comparison = new LlmNliClassifier(model, mapper)
                .compareOneToMany("User likes apples", List.of("The sky is blue", "User likes apples"));

        assertThat(comparison.results()).containsExactly(NliResult.UNRELATED, NliResult.DUPLICATE);
        assertThat(model.calls()).hasSize(1);
        assertThat(model.calls().get(0).get(1).content())
                .contains("TARGET 1: The sky is blue")
                .contains("TARGET 2: User likes apples");
    }

    @Test
    void wrongLabelCountIsCorrectedOnce() {
        ScriptedLanguageModel model = new ScriptedLanguageModel()
                .when("SOURCE", "{\"results\": [\"Duplicate\"]}")
                .when("could not be used", "{\"results\": [\"Duplicate\", \"Contradiction\"]}");

        NliComparison comparison = new LlmNliClassifier(model, mapper)
                .compareOneToMany("a", List.of("b", "c"));

        assertThat(comparison.failed()).isFalse();
        assertThat(comparison.results()).containsExactly(NliResult.DUPLICATE, NliResult.CONTRADICTION);
        assertThat(model.calls()).hasSize(2);
    }

    @Test
    void unknownLabelIsCorrectedOnce() {
        ScriptedLanguageModel model = new ScriptedLanguageModel()
                .when("SOURCE", "{\"results\": [\"Entailment\"]}")
                .when("could not be used", "{\"results\": [\"Duplicate\"]}");

        NliComparison comparison = new LlmNliClassifier(model, mapper).compareOneToMany("a", List.of("b"));

        assertThat(comparison.failed()).isFalse();
        assertThat(comparison.results()).containsExactly(NliResult.DUPLICATE);
        assertThat(model.calls()).hasSize(2);
    }

    @Test
    void persistentUnknownLabelIsReportedAsFailure() {
        ScriptedLanguageModel model = new ScriptedLanguageModel()
                .when("SOURCE", "{\"results\": [\"Entailment\"]}")
                .when("could not be used", "{\"results\": [\"Neutral\"]}");

        NliComparison comparison = new LlmNliClassifier(model, mapper).compareOneToMany("a", List.of("b"));

        assertThat(comparison.failed()).isTrue();
        assertThat(comparison.results()).containsExactly(NliResult.UNRELATED);
    }

    @Test
    void outageFallsBackToUnrelated() {
        ScriptedLanguageModel model = new ScriptedLanguageModel().when("SOURCE", (String) null);

        NliComparison comparison = new LlmNliClassifier(model, mapper)
                .compareOneToMany("a", List.of("b", "c"));

        assertThat(comparison.failed()).isTrue();
        assertThat(comparison.results()).containsOnly(NliResult.UNRELATED).hasSize(2);
    }

    @Test
    void noTargetsNoCall() {
        ScriptedLanguageModel model = new ScriptedLanguageModel();

        assertThat(new LlmNliClassifier(model, mapper).compareOneToMany("a", List.of()).results()).isEmpty();
        assertThat(model.calls()).isEmpty();
    }
}
