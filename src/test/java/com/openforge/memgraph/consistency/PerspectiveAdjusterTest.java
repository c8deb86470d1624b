package com.openforge.memgraph.consistency;

import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.model.SourceRef;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PerspectiveAdjusterTest {

    private final PerspectiveAdjuster adjuster = new PerspectiveAdjuster();

    @Test
    void rewritesEnglishFirstPersonForUser() {
        String adjusted = adjuster.adjust("I went to the store myself.", "user", "en");

        assertThat(adjusted).isEqualTo("User went to the store User himself.");
    }

    @Test
    void rewritesPossessivesAndObjectPronouns() {
        assertThat(adjuster.adjust("My dog likes me", "user", "en")).isEqualTo("User's dog likes User");
        assertThat(adjuster.adjust("That book is mine", "assistant", "en")).isEqualTo("That book is Assistant's");
    }

    @Test
    void rewritesChineseFirstPerson() {
        assertThat(adjuster.adjust("我喜欢吃苹果", "user", "zh")).isEqualTo("用户喜欢吃苹果");
        assertThat(adjuster.adjust("我喜欢吃苹果", "assistant", "zh")).isEqualTo("助手喜欢吃苹果");
    }

    @Test
    void detectsLanguageWhenNoneDeclared() {
        assertThat(adjuster.adjust("我喜欢吃苹果", "user", null)).contains("用户");
        assertThat(adjuster.adjust("I like apples", "user", null)).isEqualTo("User like apples");
    }

    @Test
    void leavesWordsContainingPronounLettersAlone() {
        assertThat(adjuster.adjust("Imagine Mexico in Miami", "user", "en")).isEqualTo("Imagine Mexico in Miami");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "I went to the store myself.",
            "My sister told me I'm late",
            "That is mine, not yours",
            "我和我的朋友去了公园",
            "The user likes apples."
    })
    void adjustingTwiceEqualsAdjustingOnce(String text) {
        String once = adjuster.adjust(text, "user", null);

        assertThat(adjuster.adjust(once, "user", null)).isEqualTo(once);
    }

    @Test
    void usesOriginMessageOfNode() {
        MemoryNode node = MemoryNode.builder()
                .id("n1")
                .text("I moved to Berlin")
                .sources(List.of(SourceRef.message("assistant", "en")))
                .build();

        assertThat(adjuster.adjust(node)).isEqualTo("Assistant moved to Berlin");
    }

    @Test
    void nodeWithoutOriginMessageIsUnchanged() {
        MemoryNode node = MemoryNode.builder().id("n1").text("I moved to Berlin").build();

        assertThat(adjuster.adjust(node)).isEqualTo("I moved to Berlin");
    }
}
