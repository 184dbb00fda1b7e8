package com.openforge.mindstore.web;

import com.openforge.mindstore.thought.CausalChainFinder;
import com.openforge.mindstore.thought.NeuroSymbolicStatisticsService;
import com.openforge.mindstore.thought.NeuroSymbolicStats;
import com.openforge.mindstore.thought.RelationInferenceEngine;
import com.openforge.mindstore.thought.Thought;
import com.openforge.mindstore.thought.ThoughtOrigin;
import com.openforge.mindstore.thought.ThoughtRelation;
import com.openforge.mindstore.thought.ThoughtStatistics;
import com.openforge.mindstore.thought.ThoughtStore;
import com.openforge.mindstore.thought.ThoughtType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API over the thought memory of agent sessions.
 *
 * ┌─────────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                                         Description           │
 * ├─────────────────────────────────────────────────────────────────────────┤
 * │  GET    /api/thoughts                             sessions with thoughts│
 * │  GET    /api/thoughts/{sid}                       all thoughts, oldest 1│
 * │  GET    /api/thoughts/{sid}/recent?count=10       newest first          │
 * │  GET    /api/thoughts/{sid}/search?q=&limit=20    semantic / substring  │
 * │  GET    /api/thoughts/{sid}/stats                 counts + chain stats  │
 * │  GET    /api/thoughts/{sid}/{tid}/chains?maxDepth causal chains         │
 * │  POST   /api/thoughts/{sid}                       save, infer relations │
 * │  DELETE /api/thoughts/{sid}                       drop the whole session│
 * └─────────────────────────────────────────────────────────────────────────┘
 */
@RestController
@RequestMapping("/api/thoughts")
@RequiredArgsConstructor
public class ThoughtController {

    private final ThoughtStore                   thoughtStore;
    private final RelationInferenceEngine        inferenceEngine;
    private final CausalChainFinder              chainFinder;
    private final NeuroSymbolicStatisticsService statisticsService;
    private final Clock                          clock;

    @GetMapping
    public ResponseEntity<List<String>> listSessions() {
        return ResponseEntity.ok(thoughtStore.listSessions());
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<List<Thought>> getThoughts(@PathVariable String sessionId) {
        return ResponseEntity.ok(thoughtStore.getThoughts(sessionId));
    }

    @GetMapping("/{sessionId}/recent")
    public ResponseEntity<List<Thought>> getRecent(
            @PathVariable String sessionId,
            @RequestParam(defaultValue = "10") int count) {
        return ResponseEntity.ok(thoughtStore.getRecentThoughts(sessionId, count));
    }

    /**
     * Session-scoped search. Vector similarity when an embedding endpoint is
     * configured, case-insensitive substring match otherwise.
     */
    @GetMapping("/{sessionId}/search")
    public ResponseEntity<List<Thought>> search(
            @PathVariable String sessionId,
            @RequestParam("q") String query,
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(thoughtStore.searchThoughts(sessionId, query, limit));
    }

    @GetMapping("/{sessionId}/stats")
    public ResponseEntity<SessionStats> stats(@PathVariable String sessionId) {
        return ResponseEntity.ok(new SessionStats(
                thoughtStore.getStatistics(sessionId),
                statisticsService.getStats(sessionId)));
    }

    @GetMapping("/{sessionId}/{thoughtId}/chains")
    public ResponseEntity<List<List<Thought>>> chains(
            @PathVariable String sessionId,
            @PathVariable UUID thoughtId,
            @RequestParam(defaultValue = "" + CausalChainFinder.DEFAULT_MAX_DEPTH) int maxDepth) {
        return ResponseEntity.ok(chainFinder.findCausalChains(sessionId, thoughtId, maxDepth));
    }

    /**
     * Saves a thought and, unless {@code auto_infer} is false, links it to the
     * session's recent thoughts. The id is generated when not supplied.
     */
    @PostMapping("/{sessionId}")
    public ResponseEntity<SaveThoughtResponse> save(
            @PathVariable String sessionId,
            @Valid @RequestBody SaveThoughtRequest req) {
        Thought thought = Thought.builder()
                .id(req.id() != null ? req.id() : UUID.randomUUID())
                .sessionId(sessionId)
                .type(ThoughtType.of(req.type()))
                .origin(req.origin() != null ? ThoughtOrigin.of(req.origin()) : ThoughtOrigin.Known.REACTIVE)
                .content(req.content())
                .confidence(req.confidence() != null ? req.confidence() : 1.0)
                .relevance(req.relevance() != null ? req.relevance() : 1.0)
                .timestamp(clock.instant())
                .parentThoughtId(req.parentThoughtId())
                .topic(req.topic())
                .tags(req.tags())
                .metadata(req.metadata())
                .build();

        List<ThoughtRelation> relations = inferenceEngine.saveWithRelations(
                sessionId, thought, req.autoInfer() == null || req.autoInfer());
        return ResponseEntity.status(HttpStatus.CREATED).body(new SaveThoughtResponse(thought, relations));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> clear(@PathVariable String sessionId) {
        thoughtStore.clearSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    // ── Inner DTOs ───────────────────────────────────────────────────────────

    public record SaveThoughtRequest(
            UUID id,
            @NotBlank String type,
            String origin,
            @NotBlank String content,
            @DecimalMin("0.0") @DecimalMax("1.0") Double confidence,
            @DecimalMin("0.0") @DecimalMax("1.0") Double relevance,
            UUID parentThoughtId,
            String topic,
            List<String> tags,
            Map<String, Object> metadata,
            Boolean autoInfer
    ) {}

    public record SaveThoughtResponse(Thought thought, List<ThoughtRelation> inferredRelations) {}

    public record SessionStats(ThoughtStatistics thoughts, NeuroSymbolicStats neuroSymbolic) {}
}
