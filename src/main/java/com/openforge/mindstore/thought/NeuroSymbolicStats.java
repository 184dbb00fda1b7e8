package com.openforge.mindstore.thought;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * Combined view of a session's thoughts (neural layer) and the relation
 * graph over them (symbolic layer).
 *
 * @param causalChainCount   number of chain starts (thoughts with no incoming relation)
 * @param averageChainLength mean longest-chain length over a bounded sample of chain starts
 */
public record NeuroSymbolicStats(
        int                  totalThoughts,
        int                  totalRelations,
        int                  totalResults,
        Map<String, Integer> thoughtsByType,
        Map<String, Integer> relationsByType,
        Map<String, Integer> resultsByType,
        int                  causalChainCount,
        double               averageChainLength,
        @Nullable Instant    oldestThought,
        @Nullable Instant    newestThought
) {}
