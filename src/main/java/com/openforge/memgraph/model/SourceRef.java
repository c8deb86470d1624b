package com.openforge.memgraph.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One provenance entry on a memory node.
 *
 * kind variants:
 *   MESSAGE    — raw chat message the fact was extracted from; carries role + lang
 *   NODE       — another memory node this fact was derived from (inference, aggregation)
 *   SUCCESSOR  — set on MERGED nodes; nodeId names the node that replaced this one
 *
 * @param kind    provenance variant
 * @param role    message role ("user", "assistant"); MESSAGE only
 * @param lang    message language code ("en", "zh"); MESSAGE only, may be null
 * @param nodeId  referenced node id; NODE and SUCCESSOR only
 * @param content free-form descriptor (message excerpt, document name …)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceRef(
        Kind   kind,
        String role,
        String lang,
        String nodeId,
        String content
) {

    public enum Kind { MESSAGE, NODE, SUCCESSOR }

    // ── Static factory helpers ──────────────────────────────────────────────

    public static SourceRef message(String role, String lang) {
        return new SourceRef(Kind.MESSAGE, role, lang, null, null);
    }

    public static SourceRef message(String role, String lang, String content) {
        return new SourceRef(Kind.MESSAGE, role, lang, null, content);
    }

    public static SourceRef node(String nodeId) {
        return new SourceRef(Kind.NODE, null, null, nodeId, null);
    }

    public static SourceRef successor(String nodeId) {
        return new SourceRef(Kind.SUCCESSOR, null, null, nodeId, null);
    }
}
