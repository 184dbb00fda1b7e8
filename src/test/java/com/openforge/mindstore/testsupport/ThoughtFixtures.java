package com.openforge.mindstore.testsupport;

import com.openforge.mindstore.thought.Thought;
import com.openforge.mindstore.thought.ThoughtOrigin;
import com.openforge.mindstore.thought.ThoughtType;

import java.time.Instant;
import java.util.UUID;

public final class ThoughtFixtures {

    public static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private ThoughtFixtures() {}

    public static Thought thought(String sessionId, ThoughtType type, String content, int secondsAfterT0) {
        return Thought.builder()
                .id(UUID.randomUUID())
                .sessionId(sessionId)
                .type(type)
                .origin(ThoughtOrigin.Known.REACTIVE)
                .content(content)
                .confidence(0.8)
                .relevance(0.6)
                .timestamp(T0.plusSeconds(secondsAfterT0))
                .build();
    }
}
