package com.openforge.mindstore.thought;

import lombok.Builder;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Atomic persisted unit of agent reasoning.
 *
 * Immutable once written: there is no update, a correction is a new thought
 * whose {@code parentThoughtId} points at the one it corrects. The id is
 * assigned by the caller, so saving the same thought twice replaces it.
 *
 * @param id              caller-assigned identifier, also the backend point id
 * @param sessionId       owning session; filled from storage on read
 * @param type            reasoning-step kind
 * @param origin          what produced the thought
 * @param content         the thought text (embedded for semantic search)
 * @param confidence      0.0 – 1.0
 * @param relevance       0.0 – 1.0
 * @param timestamp       UTC creation time
 * @param parentThoughtId thought this one continues or corrects
 * @param topic           free-form topic label
 * @param tags            free-form labels, never null
 * @param metadata        free-form attributes, never null
 */
@Builder(toBuilder = true)
public record Thought(
        UUID                   id,
        @Nullable String       sessionId,
        ThoughtType            type,
        ThoughtOrigin          origin,
        String                 content,
        double                 confidence,
        double                 relevance,
        Instant                timestamp,
        @Nullable UUID         parentThoughtId,
        @Nullable String       topic,
        List<String>           tags,
        Map<String, Object>    metadata
) {

    public Thought {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(timestamp, "timestamp");
        requireUnit(confidence, "confidence");
        requireUnit(relevance, "relevance");
        tags     = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Thought withSessionId(String session) {
        return toBuilder().sessionId(session).build();
    }

    static void requireUnit(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0, 1], got " + value);
        }
    }
}
