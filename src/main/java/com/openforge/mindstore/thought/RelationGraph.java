package com.openforge.mindstore.thought;

import com.openforge.mindstore.vector.PointFilter;
import com.openforge.mindstore.vector.StoredPoint;
import com.openforge.mindstore.vector.VectorBackendClient;
import com.openforge.mindstore.vector.VectorPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Typed directed edges between thoughts, stored as points in the relations
 * collection. The point vector embeds {@code "<type>: <source> -> <target>"}
 * so relations stay searchable; without an embedding function it is the
 * zero vector.
 */
@Slf4j
@Service
public class RelationGraph {

    private final VectorBackendClient      backend;
    private final ThoughtStore             thoughtStore;
    private final ThoughtStoreProperties   props;
    private final ThoughtPayloadCodec      codec;
    private final ThoughtCollectionManager collections;

    public RelationGraph(VectorBackendClient backend,
                         ThoughtStore thoughtStore,
                         ThoughtStoreProperties props,
                         ThoughtPayloadCodec codec,
                         ThoughtCollectionManager collections) {
        this.backend      = backend;
        this.thoughtStore = thoughtStore;
        this.props        = props;
        this.codec        = codec;
        this.collections  = collections;
    }

    public void saveRelation(String sessionId, ThoughtRelation relation) {
        ThoughtStore.requireSession(sessionId);
        String text = relation.type().wire() + ": " + relation.sourceThoughtId() + " -> " + relation.targetThoughtId();
        VectorPoint point = new VectorPoint(relation.id().toString(), thoughtStore.embed(text),
                codec.toPayload(sessionId, relation));

        thoughtStore.sessionLocks().withLock(sessionId, () -> {
            collections.ensureCollection(props.relationsCollection());
            backend.upsert(props.relationsCollection(), List.of(point));
        });
        log.debug("[Thoughts] Saved relation {} {} -> {}",
                relation.type().wire(), relation.sourceThoughtId(), relation.targetThoughtId());
    }

    /** Incoming and outgoing relations of a thought, across sessions. */
    public List<ThoughtRelation> getRelationsForThought(UUID thoughtId) {
        String id = thoughtId.toString();
        return read(PointFilter.anyOf(
                PointFilter.field(ThoughtPayloadCodec.SOURCE_THOUGHT_ID, id),
                PointFilter.field(ThoughtPayloadCodec.TARGET_THOUGHT_ID, id)));
    }

    public List<ThoughtRelation> getOutgoingRelations(UUID thoughtId) {
        return read(PointFilter.matching(ThoughtPayloadCodec.SOURCE_THOUGHT_ID, thoughtId.toString()));
    }

    public List<ThoughtRelation> getSessionRelations(String sessionId) {
        ThoughtStore.requireSession(sessionId);
        return read(ThoughtStore.sessionFilter(sessionId));
    }

    /**
     * Every (source thought, relation) pair of the given relation type in the
     * session, optionally restricted to targets of {@code targetType}.
     * Pairs whose source thought is no longer stored are dropped.
     */
    public List<SymbolicMatch> querySymbolic(String sessionId,
                                             RelationType relationType,
                                             @Nullable ThoughtType targetType) {
        Map<UUID, Thought> thoughts = thoughtStore.getThoughts(sessionId).stream()
                .collect(Collectors.toMap(Thought::id, Function.identity(), (a, b) -> b));

        List<SymbolicMatch> matches = new ArrayList<>();
        PointFilter filter = ThoughtStore.sessionFilter(sessionId)
                .and(ThoughtPayloadCodec.RELATION_TYPE, relationType.wire());
        for (ThoughtRelation relation : read(filter)) {
            Thought source = thoughts.get(relation.sourceThoughtId());
            if (source == null) continue;
            if (targetType != null) {
                Thought target = thoughts.get(relation.targetThoughtId());
                if (target == null || !target.type().equals(targetType)) continue;
            }
            matches.add(new SymbolicMatch(source, relation));
        }
        return matches;
    }

    private List<ThoughtRelation> read(PointFilter filter) {
        List<ThoughtRelation> relations = new ArrayList<>();
        for (StoredPoint p : thoughtStore.scrollAll(props.relationsCollection(), filter)) {
            codec.parseRelation(p.payload()).ifPresent(relations::add);
        }
        relations.sort(Comparator.comparing(ThoughtRelation::createdAt));
        return relations;
    }

    /** A thought together with one of its outgoing relations. */
    public record SymbolicMatch(Thought thought, ThoughtRelation relation) {}
}
