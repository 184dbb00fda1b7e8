package com.openforge.mindstore.thought;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Saves a thought and links it to the session's recent thoughts.
 *
 * For each of the last {@code inferenceWindow} thoughts an edge
 * {@code existing → new} is created when the cosine similarity of their
 * embeddings exceeds {@code similarityThreshold}, or unconditionally when
 * the existing thought is the new one's parent. The parent link always
 * yields {@code refines}; otherwise the relation type comes from the
 * injected {@link RelationTypeRule} table.
 *
 * Without an embedding function nothing is inferred and the thought is
 * saved as-is. Blank content embeds as the zero vector, so a blank thought
 * relates to nothing except through the parent link.
 */
@Slf4j
@Service
public class RelationInferenceEngine {

    private final ThoughtStore           thoughtStore;
    private final RelationGraph          relationGraph;
    private final ThoughtStoreProperties props;
    private final Clock                  clock;
    private final List<RelationTypeRule> rules;

    @Autowired
    public RelationInferenceEngine(ThoughtStore thoughtStore,
                                   RelationGraph relationGraph,
                                   ThoughtStoreProperties props,
                                   Clock clock) {
        this(thoughtStore, relationGraph, props, clock, RelationTypeRules.DEFAULT);
    }

    public RelationInferenceEngine(ThoughtStore thoughtStore,
                                   RelationGraph relationGraph,
                                   ThoughtStoreProperties props,
                                   Clock clock,
                                   List<RelationTypeRule> rules) {
        this.thoughtStore  = thoughtStore;
        this.relationGraph = relationGraph;
        this.props         = props;
        this.clock         = clock;
        this.rules         = List.copyOf(rules);
    }

    public List<ThoughtRelation> saveWithRelations(String sessionId, Thought thought) {
        return saveWithRelations(sessionId, thought, true);
    }

    /** @return the relations inferred and saved for the new thought */
    public List<ThoughtRelation> saveWithRelations(String sessionId, Thought thought, boolean autoInfer) {
        if (!autoInfer || thoughtStore.embeddingFunction() == null) {
            thoughtStore.saveThought(sessionId, thought);
            return List.of();
        }

        List<Thought> recent = thoughtStore.getRecentThoughts(sessionId, props.inferenceWindow() + 1).stream()
                .filter(t -> !t.id().equals(thought.id()))
                .limit(props.inferenceWindow())
                .toList();

        List<Float> vector = thoughtStore.embed(thought.content());
        thoughtStore.saveEmbedded(sessionId, thought, vector);

        List<ThoughtRelation> inferred = new ArrayList<>();
        Instant now = clock.instant();
        for (Thought existing : recent) {
            double similarity = cosineSimilarity(vector, thoughtStore.embed(existing.content()));
            boolean isParent  = existing.id().equals(thought.parentThoughtId());
            if (!isParent && similarity <= props.similarityThreshold()) continue;

            RelationType type = isParent
                    ? RelationType.REFINES
                    : RelationTypeRules.resolve(rules, existing.type(), thought.type());
            ThoughtRelation relation = ThoughtRelation.of(existing.id(), thought.id(), type, clamp(similarity), now);
            relationGraph.saveRelation(sessionId, relation);
            inferred.add(relation);
        }

        if (!inferred.isEmpty()) {
            log.debug("[Thoughts] Inferred {} relation(s) for thought {}", inferred.size(), thought.id());
        }
        return inferred;
    }

    /** Cosine similarity; 0 for zero-magnitude or length-mismatched vectors. */
    public static double cosineSimilarity(List<Float> a, List<Float> b) {
        if (a.size() != b.size() || a.isEmpty()) return 0.0;

        double dot = 0.0, magA = 0.0, magB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot  += x * y;
            magA += x * x;
            magB += y * y;
        }
        if (magA == 0.0 || magB == 0.0) return 0.0;
        return dot / (Math.sqrt(magA) * Math.sqrt(magB));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
