package com.openforge.memgraph.api;

import com.openforge.memgraph.consistency.WriteDecision;
import com.openforge.memgraph.consistency.WriteOutcome;
import com.openforge.memgraph.goal.ParseMode;
import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.model.MemoryType;
import com.openforge.memgraph.model.ParsedTaskGoal;
import com.openforge.memgraph.model.SourceRef;
import com.openforge.memgraph.reasoning.ReasoningResult;
import com.openforge.memgraph.retrieve.RetrievalStatus;
import com.openforge.memgraph.retrieve.ScoredNode;
import com.openforge.memgraph.service.MemoryCoreService;
import com.openforge.memgraph.store.MemoryInvariants;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * REST surface over the memory core. Every route is scoped to one namespace.
 *
 * ┌──────────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                                    Description                 │
 * ├──────────────────────────────────────────────────────────────────────────┤
 * │  POST /api/memory/{ns}/goal                  parse a query into a goal   │
 * │  POST /api/memory/{ns}/search                parse + hybrid retrieval    │
 * │  POST /api/memory/{ns}/nodes                 checked write               │
 * │  GET  /api/memory/{ns}/nodes/{id}            fetch one node              │
 * │  POST /api/memory/{ns}/nodes/{id}/reason     run ProcessNode on a node   │
 * └──────────────────────────────────────────────────────────────────────────┘
 *
 * Bodies are snake_case, like the rest of the service's JSON.
 */
@RestController
@RequestMapping("/api/memory/{namespace}")
@RequiredArgsConstructor
public class MemoryController {

    private static final int DEFAULT_TOP_K = 5;

    private final MemoryCoreService memoryService;

    // ── Read path ────────────────────────────────────────────────────────────

    @PostMapping("/goal")
    public ResponseEntity<ParsedTaskGoal> parseGoal(@PathVariable String namespace,
                                                    @Valid @RequestBody GoalRequest req) {
        return ResponseEntity.ok(memoryService.parse(req.task(), modeOf(req.mode()), req.context()));
    }

    /**
     * Status in the body tells "no matches" (NO_MATCHES) apart from "store degraded"
     * (DEGRADED / UNAVAILABLE); the HTTP status is 200 in all of those cases.
     */
    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@PathVariable String namespace,
                                                 @Valid @RequestBody SearchRequest req) {
        MemoryCoreService.SearchResult result = memoryService.search(namespace, req.query(), modeOf(req.mode()),
                req.scope(), req.topK() == null ? DEFAULT_TOP_K : req.topK(), req.context());
        List<Hit> hits = result.retrieval().hits().stream().map(Hit::of).toList();
        return ResponseEntity.ok(new SearchResponse(result.goal(), result.retrieval().status(),
                result.retrieval().failedStages(), hits));
    }

    @GetMapping("/nodes/{id}")
    public ResponseEntity<NodeView> getNode(@PathVariable String namespace, @PathVariable String id) {
        return ResponseEntity.ok(NodeView.of(memoryService.getNode(namespace, id)));
    }

    // ── Write path ───────────────────────────────────────────────────────────

    /**
     * 201 when the node was written (COMMITTED or FLAGGED), 200 for a skipped duplicate,
     * 503 when the check could not run and the write was rejected.
     */
    @PostMapping("/nodes")
    public ResponseEntity<WriteOutcome> addNode(@PathVariable String namespace,
                                                @Valid @RequestBody AddNodeRequest req) {
        WriteOutcome outcome = memoryService.write(namespace, req.toCandidate());
        HttpStatus status = outcome.written() ? HttpStatus.CREATED
                : outcome.decision() == WriteDecision.REJECTED ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(outcome);
    }

    @PostMapping("/nodes/{id}/reason")
    public ResponseEntity<ReasoningResult> reason(@PathVariable String namespace,
                                                  @PathVariable String id,
                                                  @Valid @RequestBody(required = false) ReasonRequest req) {
        Set<String> exclude = req == null || req.excludeIds() == null ? Set.of() : req.excludeIds();
        Integer topK = req == null ? null : req.topK();
        return ResponseEntity.ok(memoryService.reason(namespace, id, exclude, topK));
    }

    private static ParseMode modeOf(ParseMode mode) {
        return mode == null ? ParseMode.FAST : mode;
    }

    // ── Inner DTOs ────────────────────────────────────────────────────────────

    public record GoalRequest(
            @NotBlank @Size(max = 4000) String task,
            ParseMode mode,
            String    context
    ) {}

    public record SearchRequest(
            @NotBlank @Size(max = 4000) String query,
            ParseMode  mode,
            MemoryType scope,
            @Min(1) @Max(50) Integer topK,
            String     context
    ) {}

    public record SearchResponse(
            ParsedTaskGoal  goal,
            RetrievalStatus status,
            List<String>    failedStages,
            List<Hit>       hits
    ) {}

    public record Hit(
            String            id,
            String            text,
            double            score,
            ScoredNode.Origin origin,
            MemoryType        memoryType,
            String            key,
            Set<String>       tags,
            Instant           updatedAt
    ) {
        static Hit of(ScoredNode s) {
            MemoryNode n = s.node();
            return new Hit(n.id(), n.text(), s.score(), s.origin(), n.memoryType(), n.key(), n.tags(), n.updatedAt());
        }
    }

    /**
     * @param role originating message role ("user", "assistant"); drives perspective adjustment
     * @param lang originating message language; detected when absent
     */
    public record AddNodeRequest(
            String id,
            @NotBlank @Size(max = MemoryInvariants.MAX_TEXT_LENGTH) String text,
            MemoryType  memoryType,
            String      key,
            Set<String> tags,
            @DecimalMin("0.0") @DecimalMax("1.0") Double confidence,
            String      background,
            String      role,
            String      lang
    ) {
        MemoryNode toCandidate() {
            return MemoryNode.builder()
                    .id(id)
                    .text(text)
                    .memoryType(memoryType)
                    .key(key)
                    .tags(tags)
                    .confidence(confidence == null ? 1.0 : confidence)
                    .background(background)
                    .sources(role == null || role.isBlank() ? List.of() : List.of(SourceRef.message(role, lang)))
                    .build();
        }
    }

    public record NodeView(
            String          id,
            String          text,
            MemoryType      memoryType,
            String          key,
            Set<String>     tags,
            double          confidence,
            String          background,
            List<SourceRef> sources,
            String          status,
            Instant         createdAt,
            Instant         updatedAt
    ) {
        static NodeView of(MemoryNode n) {
            return new NodeView(n.id(), n.text(), n.memoryType(), n.key(), n.tags(), n.confidence(),
                    n.background(), n.sources(), n.status().name(), n.createdAt(), n.updatedAt());
        }
    }

    public record ReasonRequest(
            Set<String> excludeIds,
            @Min(1) @Max(50) Integer topK
    ) {}
}
