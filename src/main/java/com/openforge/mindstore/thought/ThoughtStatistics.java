package com.openforge.mindstore.thought;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * Summary of one session's thoughts. Counts are keyed by the wire tag.
 */
public record ThoughtStatistics(
        int                  totalCount,
        Map<String, Integer> countByType,
        Map<String, Integer> countByOrigin,
        double               averageConfidence,
        double               averageRelevance,
        @Nullable Instant    earliestThought,
        @Nullable Instant    latestThought
) {

    public static ThoughtStatistics empty() {
        return new ThoughtStatistics(0, Map.of(), Map.of(), 0.0, 0.0, null, null);
    }
}
