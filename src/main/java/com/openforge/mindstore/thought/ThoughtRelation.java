package com.openforge.mindstore.thought;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Typed directed edge between two thoughts (or a thought and one of its
 * results). Cycles are allowed; the endpoints are not checked for existence.
 *
 * @param strength 0.0 – 1.0
 */
public record ThoughtRelation(
        UUID                id,
        UUID                sourceThoughtId,
        UUID                targetThoughtId,
        RelationType        type,
        double              strength,
        Instant             createdAt,
        Map<String, Object> metadata
) {

    public ThoughtRelation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceThoughtId, "sourceThoughtId");
        Objects.requireNonNull(targetThoughtId, "targetThoughtId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(createdAt, "createdAt");
        Thought.requireUnit(strength, "strength");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ThoughtRelation of(UUID source, UUID target, RelationType type,
                                     double strength, Instant createdAt) {
        return new ThoughtRelation(UUID.randomUUID(), source, target, type, strength, createdAt, null);
    }

    public boolean isOutgoingFrom(UUID thoughtId) {
        return sourceThoughtId.equals(thoughtId);
    }

    @Nullable
    public UUID otherEnd(UUID thoughtId) {
        if (sourceThoughtId.equals(thoughtId)) return targetThoughtId;
        if (targetThoughtId.equals(thoughtId)) return sourceThoughtId;
        return null;
    }
}
