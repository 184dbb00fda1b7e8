package com.openforge.mindstore.thought;

import java.util.List;

import static com.openforge.mindstore.thought.ThoughtType.Known.ANALYTICAL;
import static com.openforge.mindstore.thought.ThoughtType.Known.CREATIVE;
import static com.openforge.mindstore.thought.ThoughtType.Known.DECISION;
import static com.openforge.mindstore.thought.ThoughtType.Known.EMOTIONAL;
import static com.openforge.mindstore.thought.ThoughtType.Known.MEMORY_RECALL;
import static com.openforge.mindstore.thought.ThoughtType.Known.OBSERVATION;
import static com.openforge.mindstore.thought.ThoughtType.Known.SELF_REFLECTION;
import static com.openforge.mindstore.thought.ThoughtType.Known.STRATEGIC;
import static com.openforge.mindstore.thought.ThoughtType.Known.SYNTHESIS;

/**
 * Ordered relation-type table, first match wins:
 *
 * ┌────────────────┬────────────────┬─────────────┐
 * │ existing       │ new            │ relation    │
 * ├────────────────┼────────────────┼─────────────┤
 * │ Observation    │ Analytical     │ leads_to    │
 * │ Analytical     │ Decision       │ leads_to    │
 * │ Emotional      │ SelfReflection │ triggers    │
 * │ MemoryRecall   │ *              │ supports    │
 * │ Strategic      │ Decision       │ leads_to    │
 * │ Synthesis      │ *              │ abstracts   │
 * │ Creative       │ *              │ elaborates  │
 * │ *              │ Synthesis      │ part_of     │
 * │ *              │ Decision       │ leads_to    │
 * │ (no match)     │                │ similar_to  │
 * └────────────────┴────────────────┴─────────────┘
 */
public final class RelationTypeRules {

    public static final List<RelationTypeRule> DEFAULT = List.of(
            new RelationTypeRule(OBSERVATION,   ANALYTICAL,      RelationType.LEADS_TO),
            new RelationTypeRule(ANALYTICAL,    DECISION,        RelationType.LEADS_TO),
            new RelationTypeRule(EMOTIONAL,     SELF_REFLECTION, RelationType.TRIGGERS),
            new RelationTypeRule(MEMORY_RECALL, null,            RelationType.SUPPORTS),
            new RelationTypeRule(STRATEGIC,     DECISION,        RelationType.LEADS_TO),
            new RelationTypeRule(SYNTHESIS,     null,            RelationType.ABSTRACTS),
            new RelationTypeRule(CREATIVE,      null,            RelationType.ELABORATES),
            new RelationTypeRule(null,          SYNTHESIS,       RelationType.PART_OF),
            new RelationTypeRule(null,          DECISION,        RelationType.LEADS_TO));

    public static final RelationType FALLBACK = RelationType.SIMILAR_TO;

    private RelationTypeRules() {}

    public static RelationType resolve(List<RelationTypeRule> rules, ThoughtType existing, ThoughtType incoming) {
        for (RelationTypeRule rule : rules) {
            if (rule.matches(existing, incoming)) return rule.result();
        }
        return FALLBACK;
    }
}
