package com.openforge.mindstore.thought;

import org.junit.jupiter.api.Test;

import static com.openforge.mindstore.thought.ThoughtType.Known.*;
import static org.junit.jupiter.api.Assertions.*;

class RelationTypeRulesTest {

    private static RelationType resolve(ThoughtType existing, ThoughtType incoming) {
        return RelationTypeRules.resolve(RelationTypeRules.DEFAULT, existing, incoming);
    }

    @Test
    void shouldResolveExplicitPairs() {
        assertEquals(RelationType.LEADS_TO, resolve(OBSERVATION, ANALYTICAL));
        assertEquals(RelationType.LEADS_TO, resolve(ANALYTICAL, DECISION));
        assertEquals(RelationType.TRIGGERS, resolve(EMOTIONAL, SELF_REFLECTION));
        assertEquals(RelationType.LEADS_TO, resolve(STRATEGIC, DECISION));
    }

    @Test
    void shouldApplyFirstMatchingRule() {
        // MemoryRecall wins over (*, Synthesis) and (*, Decision)
        assertEquals(RelationType.SUPPORTS, resolve(MEMORY_RECALL, SYNTHESIS));
        assertEquals(RelationType.SUPPORTS, resolve(MEMORY_RECALL, DECISION));
        assertEquals(RelationType.ABSTRACTS, resolve(SYNTHESIS, DECISION));
        assertEquals(RelationType.ELABORATES, resolve(CREATIVE, SYNTHESIS));
        assertEquals(RelationType.PART_OF, resolve(OBSERVATION, SYNTHESIS));
        assertEquals(RelationType.LEADS_TO, resolve(EMOTIONAL, DECISION));
    }

    @Test
    void shouldFallBackToSimilarTo() {
        assertEquals(RelationType.SIMILAR_TO, resolve(OBSERVATION, OBSERVATION));
        assertEquals(RelationType.SIMILAR_TO, resolve(ANALYTICAL, OBSERVATION));
        assertEquals(RelationType.SIMILAR_TO, resolve(new ThoughtType.Other("Hunch"), ANALYTICAL));
    }
}
