package com.openforge.memgraph.consistency;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Result of a checked write.
 *
 * @param decision   what happened to the candidate
 * @param nodeId     id of the written node (COMMITTED, FLAGGED); null otherwise
 * @param relatedId  existing duplicate (SKIPPED_DUPLICATE) or conflicting node (FLAGGED)
 * @param mergedIds  extra duplicates consolidated into {@code relatedId}
 * @param unchecked  true when a collaborator failure kept the check from completing
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WriteOutcome(
        WriteDecision decision,
        String        nodeId,
        String        relatedId,
        List<String>  mergedIds,
        boolean       unchecked
) {

    public WriteOutcome {
        mergedIds = mergedIds == null ? List.of() : List.copyOf(mergedIds);
    }

    public static WriteOutcome committed(String nodeId, boolean unchecked) {
        return new WriteOutcome(WriteDecision.COMMITTED, nodeId, null, List.of(), unchecked);
    }

    public static WriteOutcome duplicate(String existingId, List<String> mergedIds) {
        return new WriteOutcome(WriteDecision.SKIPPED_DUPLICATE, null, existingId, mergedIds, false);
    }

    public static WriteOutcome flagged(String nodeId, String conflictingId) {
        return new WriteOutcome(WriteDecision.FLAGGED, nodeId, conflictingId, List.of(), false);
    }

    public static WriteOutcome rejected() {
        return new WriteOutcome(WriteDecision.REJECTED, null, null, List.of(), true);
    }

    public boolean written() {
        return decision == WriteDecision.COMMITTED || decision == WriteDecision.FLAGGED;
    }
}
