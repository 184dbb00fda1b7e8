package com.openforge.mindstore.thought;

import com.openforge.mindstore.testsupport.FakeEmbeddingFunction;
import com.openforge.mindstore.testsupport.MemoryHarness;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.openforge.mindstore.testsupport.ThoughtFixtures.thought;
import static org.junit.jupiter.api.Assertions.*;

class RelationInferenceEngineTest {

    private static final String SESSION = "s";

    @Test
    void shouldLinkAnalyticalToDecisionWithIdenticalEmbeddings() {
        FakeEmbeddingFunction embedder = new FakeEmbeddingFunction(3)
                .map("the index is missing", 1, 2, 3)
                .map("add the index", 1, 2, 3);
        MemoryHarness h = new MemoryHarness(3, embedder);
        Thought analysis = thought(SESSION, ThoughtType.Known.ANALYTICAL, "the index is missing", 0);
        Thought decision = thought(SESSION, ThoughtType.Known.DECISION, "add the index", 1);
        h.thoughts.saveThought(SESSION, analysis);

        List<ThoughtRelation> inferred = h.inference.saveWithRelations(SESSION, decision);

        assertEquals(1, inferred.size());
        ThoughtRelation r = inferred.get(0);
        assertEquals(analysis.id(), r.sourceThoughtId());
        assertEquals(decision.id(), r.targetThoughtId());
        assertEquals(RelationType.LEADS_TO, r.type());
        assertEquals(1.0, r.strength(), 1e-6);
        assertEquals(MemoryHarness.CLOCK.instant(), r.createdAt());
        assertEquals(inferred, h.relations.getSessionRelations(SESSION));
        assertEquals(2, h.thoughts.getThoughts(SESSION).size());
    }

    @Test
    void shouldPreferRefinesForParentEvenBelowThreshold() {
        FakeEmbeddingFunction embedder = new FakeEmbeddingFunction(2)
                .map("the build is red", 1, 0)
                .map("a flaky test causes it", 0, 1);
        MemoryHarness h = new MemoryHarness(2, embedder);
        Thought observation = thought(SESSION, ThoughtType.Known.OBSERVATION, "the build is red", 0);
        Thought analysis = thought(SESSION, ThoughtType.Known.ANALYTICAL, "a flaky test causes it", 1).toBuilder()
                .parentThoughtId(observation.id())
                .build();
        h.thoughts.saveThought(SESSION, observation);

        List<ThoughtRelation> inferred = h.inference.saveWithRelations(SESSION, analysis);

        assertEquals(1, inferred.size());
        assertEquals(RelationType.REFINES, inferred.get(0).type());
        assertEquals(0.0, inferred.get(0).strength(), 1e-9);
    }

    @Test
    void shouldPreferRefinesOverTableWhenSimilar() {
        FakeEmbeddingFunction embedder = new FakeEmbeddingFunction(2)
                .map("seen", 1, 0)
                .map("analysed", 1, 0);
        MemoryHarness h = new MemoryHarness(2, embedder);
        Thought observation = thought(SESSION, ThoughtType.Known.OBSERVATION, "seen", 0);
        Thought analysis = thought(SESSION, ThoughtType.Known.ANALYTICAL, "analysed", 1).toBuilder()
                .parentThoughtId(observation.id())
                .build();
        h.thoughts.saveThought(SESSION, observation);

        assertEquals(RelationType.REFINES, h.inference.saveWithRelations(SESSION, analysis).get(0).type());
    }

    @Test
    void shouldNotLinkDissimilarThoughts() {
        FakeEmbeddingFunction embedder = new FakeEmbeddingFunction(2)
                .map("weather", 1, 0)
                .map("taxes", 0, 1);
        MemoryHarness h = new MemoryHarness(2, embedder);
        h.thoughts.saveThought(SESSION, thought(SESSION, ThoughtType.Known.OBSERVATION, "weather", 0));

        List<ThoughtRelation> inferred = h.inference.saveWithRelations(SESSION,
                thought(SESSION, ThoughtType.Known.OBSERVATION, "taxes", 1));

        assertTrue(inferred.isEmpty());
        assertTrue(h.relations.getSessionRelations(SESSION).isEmpty());
    }

    @Test
    void shouldOnlyCompareAgainstInferenceWindow() {
        FakeEmbeddingFunction embedder = new FakeEmbeddingFunction(2).map("same", 1, 1);
        MemoryHarness h = new MemoryHarness(2, embedder);
        for (int i = 0; i < 12; i++) {
            h.thoughts.saveThought(SESSION, thought(SESSION, ThoughtType.Known.OBSERVATION, "same", i));
        }

        List<ThoughtRelation> inferred = h.inference.saveWithRelations(SESSION,
                thought(SESSION, ThoughtType.Known.OBSERVATION, "same", 100));

        assertEquals(h.props.inferenceWindow(), inferred.size());
        assertTrue(inferred.stream().allMatch(r -> r.type() == RelationType.SIMILAR_TO));
    }

    @Test
    void shouldSaveWithoutInferenceWhenNoEmbeddingFunction() {
        MemoryHarness h = new MemoryHarness(2, null);
        Thought parent = thought(SESSION, ThoughtType.Known.OBSERVATION, "p", 0);
        h.thoughts.saveThought(SESSION, parent);

        List<ThoughtRelation> inferred = h.inference.saveWithRelations(SESSION,
                thought(SESSION, ThoughtType.Known.ANALYTICAL, "c", 1).toBuilder().parentThoughtId(parent.id()).build());

        assertTrue(inferred.isEmpty());
        assertEquals(2, h.thoughts.getThoughts(SESSION).size());
    }

    @Test
    void shouldSkipInferenceWhenDisabled() {
        FakeEmbeddingFunction embedder = new FakeEmbeddingFunction(2).map("same", 1, 1);
        MemoryHarness h = new MemoryHarness(2, embedder);
        h.thoughts.saveThought(SESSION, thought(SESSION, ThoughtType.Known.OBSERVATION, "same", 0));

        assertTrue(h.inference.saveWithRelations(SESSION,
                thought(SESSION, ThoughtType.Known.OBSERVATION, "same", 1), false).isEmpty());
    }

    @Test
    void shouldToleratePreviousBlankThought() {
        FakeEmbeddingFunction embedder = new FakeEmbeddingFunction(2).map("same", 1, 1);
        MemoryHarness h = new MemoryHarness(2, embedder);
        Thought blank = thought(SESSION, ThoughtType.Known.OBSERVATION, "", 0);
        Thought similar = thought(SESSION, ThoughtType.Known.OBSERVATION, "same", 1);
        h.thoughts.saveThought(SESSION, blank);
        h.thoughts.saveThought(SESSION, similar);

        Thought analysis = thought(SESSION, ThoughtType.Known.ANALYTICAL, "same", 2).toBuilder()
                .parentThoughtId(blank.id())
                .build();
        List<ThoughtRelation> inferred = h.inference.saveWithRelations(SESSION, analysis);

        assertEquals(2, inferred.size());
        ThoughtRelation fromBlank = inferred.stream()
                .filter(r -> r.sourceThoughtId().equals(blank.id())).findFirst().orElseThrow();
        assertEquals(RelationType.REFINES, fromBlank.type());
        assertEquals(0.0, fromBlank.strength(), 1e-9);
        ThoughtRelation fromSimilar = inferred.stream()
                .filter(r -> r.sourceThoughtId().equals(similar.id())).findFirst().orElseThrow();
        assertEquals(RelationType.LEADS_TO, fromSimilar.type());
        assertEquals(3, h.thoughts.getThoughts(SESSION).size());
    }

    @Test
    void shouldRelateBlankNewThoughtOnlyThroughParent() {
        FakeEmbeddingFunction embedder = new FakeEmbeddingFunction(2).map("same", 1, 1);
        MemoryHarness h = new MemoryHarness(2, embedder);
        Thought parent = thought(SESSION, ThoughtType.Known.OBSERVATION, "same", 0);
        Thought other = thought(SESSION, ThoughtType.Known.OBSERVATION, "same", 1);
        h.thoughts.saveThought(SESSION, parent);
        h.thoughts.saveThought(SESSION, other);

        List<ThoughtRelation> inferred = h.inference.saveWithRelations(SESSION,
                thought(SESSION, ThoughtType.Known.DECISION, "  ", 2).toBuilder().parentThoughtId(parent.id()).build());

        assertEquals(1, inferred.size());
        assertEquals(parent.id(), inferred.get(0).sourceThoughtId());
        assertEquals(RelationType.REFINES, inferred.get(0).type());
    }

    @Test
    void shouldUseInjectedRuleTable() {
        FakeEmbeddingFunction embedder = new FakeEmbeddingFunction(2).map("same", 1, 1);
        MemoryHarness h = new MemoryHarness(2, embedder);
        RelationInferenceEngine engine = new RelationInferenceEngine(h.thoughts, h.relations, h.props,
                MemoryHarness.CLOCK, List.of(new RelationTypeRule(null, null, RelationType.CONTRADICTS)));
        h.thoughts.saveThought(SESSION, thought(SESSION, ThoughtType.Known.OBSERVATION, "same", 0));

        List<ThoughtRelation> inferred = engine.saveWithRelations(SESSION,
                thought(SESSION, ThoughtType.Known.OBSERVATION, "same", 1));

        assertEquals(RelationType.CONTRADICTS, inferred.get(0).type());
    }

    // ==================== cosine ====================

    @Test
    void shouldComputeCosineSimilarity() {
        assertEquals(1.0, RelationInferenceEngine.cosineSimilarity(List.of(1f, 2f), List.of(2f, 4f)), 1e-9);
        assertEquals(0.0, RelationInferenceEngine.cosineSimilarity(List.of(1f, 0f), List.of(0f, 1f)), 1e-9);
        assertEquals(-1.0, RelationInferenceEngine.cosineSimilarity(List.of(1f, 0f), List.of(-1f, 0f)), 1e-9);
    }

    @Test
    void shouldReturnZeroForDegenerateVectors() {
        assertEquals(0.0, RelationInferenceEngine.cosineSimilarity(List.of(0f, 0f), List.of(1f, 1f)));
        assertEquals(0.0, RelationInferenceEngine.cosineSimilarity(List.of(1f, 0f), List.of(1f, 0f, 0f)));
        assertEquals(0.0, RelationInferenceEngine.cosineSimilarity(List.of(), List.of()));
    }
}
