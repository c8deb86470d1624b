package com.openforge.memgraph.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A single fact in the memory graph.
 *
 * Immutable; status transitions and provenance merges produce a new instance
 * via {@link #toBuilder()} which is then written back through the store.
 *
 * Invariants (enforced by the store, see MemoryInvariants):
 *   - embedding length equals the namespace's configured dimension
 *   - a MERGED node carries a SUCCESSOR source
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MemoryNode(
        String          id,
        String          text,
        List<Float>     embedding,
        MemoryType      memoryType,
        String          key,
        Set<String>     tags,
        double          confidence,
        String          background,
        List<SourceRef> sources,
        NodeStatus      status,
        Instant         createdAt,
        Instant         updatedAt
) {

    public MemoryNode {
        tags       = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        sources    = sources == null ? List.of() : List.copyOf(sources);
        embedding  = embedding == null ? null : List.copyOf(embedding);
        memoryType = memoryType == null ? MemoryType.LONG_TERM_MEMORY : memoryType;
        status     = status == null ? NodeStatus.ACTIVATED : status;
    }

    @JsonIgnore
    public boolean isActive() {
        return status == NodeStatus.ACTIVATED;
    }

    /** The first MESSAGE source, which declares role and language of the originating message. */
    @JsonIgnore
    public Optional<SourceRef> originMessage() {
        return sources.stream().filter(s -> s.kind() == SourceRef.Kind.MESSAGE).findFirst();
    }

    @JsonIgnore
    public Optional<String> successorId() {
        return sources.stream()
                .filter(s -> s.kind() == SourceRef.Kind.SUCCESSOR)
                .map(SourceRef::nodeId)
                .findFirst();
    }
}
