package com.openforge.mindstore.thought;

import org.springframework.lang.Nullable;

/**
 * One row of the relation-type table: when the existing thought's type and
 * the new thought's type match, the relation gets {@code result}.
 * A null side matches any type.
 */
public record RelationTypeRule(
        @Nullable ThoughtType existingType,
        @Nullable ThoughtType newType,
        RelationType          result
) {

    public boolean matches(ThoughtType existing, ThoughtType incoming) {
        return (existingType == null || existingType.equals(existing))
                && (newType == null || newType.equals(incoming));
    }
}
