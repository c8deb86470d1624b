package com.openforge.memgraph.consistency;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One first-person pattern and its third-person replacement.
 * {@code {role}} in the template is substituted with the speaker's role label.
 */
public record PronounRule(Pattern pattern, String template) {

    public static PronounRule of(String regex, String template) {
        return new PronounRule(Pattern.compile(regex), template);
    }

    String apply(String text, String roleLabel) {
        return pattern.matcher(text)
                .replaceAll(Matcher.quoteReplacement(template.replace("{role}", roleLabel)));
    }
}
