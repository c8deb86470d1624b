package com.openforge.memgraph.consistency;

import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.model.SourceRef;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Rewrites first-person phrasing into the role-qualified third person used by stored facts,
 * e.g. "I went there myself" (role=user, lang=en) → "User went there User himself".
 *
 * Rules are a lookup table keyed by language; unknown languages fall back to English.
 * Replacement output never contains a first-person form, so applying the
 * adjustment twice yields the same text as applying it once.
 */
@Component
public class PerspectiveAdjuster {

    static final String DEFAULT_ROLE = "user";

    private static final Map<String, List<PronounRule>> RULES = Map.of(
            "en", List.of(
                    PronounRule.of("\\b[Mm]yself\\b", "{role} himself"),
                    PronounRule.of("\\b(?:[Mm]ine|MINE)\\b", "{role}'s"),
                    PronounRule.of("\\b(?:[Mm]y|MY)\\b", "{role}'s"),
                    PronounRule.of("\\bI'm\\b", "{role} is"),
                    PronounRule.of("\\bI\\b", "{role}"),
                    PronounRule.of("\\b(?:[Mm]e|ME)\\b", "{role}")),
            "zh", List.of(
                    PronounRule.of("我们", "{role}们"),
                    PronounRule.of("我", "{role}")));

    private static final Map<String, Map<String, String>> ROLE_LABELS = Map.of(
            "zh", Map.of("user", "用户", "assistant", "助手", "system", "系统"));

    /** Adjusts {@code node.text()} using the role and language of its originating message. */
    public String adjust(MemoryNode node) {
        Optional<SourceRef> origin = node.originMessage();
        String role = origin.map(SourceRef::role).orElse(null);
        String lang = origin.map(SourceRef::lang).orElse(null);
        if (role == null || role.isBlank()) return node.text();
        return adjust(node.text(), role, lang);
    }

    /**
     * @param lang language code; detected from the text when null or blank
     */
    public String adjust(String text, String role, String lang) {
        if (text == null || text.isEmpty()) return text;
        String language = normalizeLanguage(lang == null || lang.isBlank() ? detectLanguage(text) : lang);
        String label = roleLabel(role == null || role.isBlank() ? DEFAULT_ROLE : role, language);
        String out = text;
        for (PronounRule rule : RULES.getOrDefault(language, RULES.get("en"))) {
            out = rule.apply(out, label);
        }
        return out;
    }

    /** "zh" when the text contains any CJK ideograph, otherwise "en". */
    static String detectLanguage(String text) {
        return text.codePoints().anyMatch(cp -> Character.UnicodeScript.of(cp) == Character.UnicodeScript.HAN)
                ? "zh" : "en";
    }

    private static String normalizeLanguage(String lang) {
        String l = lang.toLowerCase(Locale.ROOT);
        int dash = l.indexOf('-');
        return dash > 0 ? l.substring(0, dash) : l;
    }

    private static String roleLabel(String role, String language) {
        String key = role.toLowerCase(Locale.ROOT);
        Map<String, String> localized = ROLE_LABELS.get(language);
        if (localized != null && localized.containsKey(key)) return localized.get(key);
        return Character.toUpperCase(key.charAt(0)) + key.substring(1);
    }
}
