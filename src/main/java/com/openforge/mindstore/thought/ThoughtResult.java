package com.openforge.mindstore.thought;

import lombok.Builder;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Outcome of acting on a thought. Saving a result also links it to its
 * thought: {@code leads_to} when successful, {@code triggers} when not.
 *
 * @param executionTime wall-clock time the action took, if measured
 */
@Builder(toBuilder = true)
public record ThoughtResult(
        UUID                id,
        UUID                thoughtId,
        ResultType          resultType,
        String              content,
        boolean             success,
        double              confidence,
        Instant             createdAt,
        @Nullable Duration  executionTime,
        Map<String, Object> metadata
) {

    public ThoughtResult {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(thoughtId, "thoughtId");
        Objects.requireNonNull(resultType, "resultType");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(createdAt, "createdAt");
        Thought.requireUnit(confidence, "confidence");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** The relation type used for the implicit thought → result edge. */
    public RelationType linkType() {
        return success ? RelationType.LEADS_TO : RelationType.TRIGGERS;
    }
}
