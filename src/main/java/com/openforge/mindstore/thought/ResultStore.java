package com.openforge.mindstore.thought;

import com.openforge.mindstore.vector.PointFilter;
import com.openforge.mindstore.vector.StoredPoint;
import com.openforge.mindstore.vector.VectorBackendClient;
import com.openforge.mindstore.vector.VectorPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Outcomes of acting on thoughts.
 *
 * Saving a result writes the result point and then the implicit
 * thought → result relation ({@code leads_to} on success, {@code triggers}
 * on failure) with strength equal to the result's confidence.
 */
@Slf4j
@Service
public class ResultStore {

    private final VectorBackendClient      backend;
    private final ThoughtStore             thoughtStore;
    private final RelationGraph            relationGraph;
    private final ThoughtStoreProperties   props;
    private final ThoughtPayloadCodec      codec;
    private final ThoughtCollectionManager collections;
    private final Clock                    clock;

    public ResultStore(VectorBackendClient backend,
                       ThoughtStore thoughtStore,
                       RelationGraph relationGraph,
                       ThoughtStoreProperties props,
                       ThoughtPayloadCodec codec,
                       ThoughtCollectionManager collections,
                       Clock clock) {
        this.backend       = backend;
        this.thoughtStore  = thoughtStore;
        this.relationGraph = relationGraph;
        this.props         = props;
        this.codec         = codec;
        this.collections   = collections;
        this.clock         = clock;
    }

    /** @return the implicit relation that was saved alongside the result */
    public ThoughtRelation saveResult(String sessionId, ThoughtResult result) {
        ThoughtStore.requireSession(sessionId);
        VectorPoint point = new VectorPoint(result.id().toString(), thoughtStore.embed(result.content()),
                codec.toPayload(sessionId, result));

        ThoughtRelation link = ThoughtRelation.of(
                result.thoughtId(), result.id(), result.linkType(), result.confidence(), clock.instant());

        thoughtStore.sessionLocks().withLock(sessionId, () -> {
            collections.ensureCollection(props.resultsCollection());
            backend.upsert(props.resultsCollection(), List.of(point));
            relationGraph.saveRelation(sessionId, link);
        });

        log.debug("[Thoughts] Saved {} result {} for thought {} ({})",
                result.resultType().wire(), result.id(), result.thoughtId(), link.type().wire());
        return link;
    }

    public List<ThoughtResult> getResultsForThought(UUID thoughtId) {
        return read(PointFilter.matching(ThoughtPayloadCodec.THOUGHT_ID, thoughtId.toString()));
    }

    public List<ThoughtResult> getSessionResults(String sessionId) {
        ThoughtStore.requireSession(sessionId);
        return read(ThoughtStore.sessionFilter(sessionId));
    }

    private List<ThoughtResult> read(PointFilter filter) {
        List<ThoughtResult> results = new ArrayList<>();
        for (StoredPoint p : thoughtStore.scrollAll(props.resultsCollection(), filter)) {
            codec.parseResult(p.payload()).ifPresent(results::add);
        }
        results.sort(Comparator.comparing(ThoughtResult::createdAt));
        return results;
    }
}
