package com.openforge.mindstore.admin;

import java.util.Map;

/**
 * Aggregate view over every collection in the backend.
 *
 * @param dimensionDistribution vector size → number of collections with that size
 */
public record MemoryStatistics(
        int                   totalCollections,
        long                  totalVectors,
        int                   healthyCollections,
        int                   unhealthyCollections,
        int                   collectionLinks,
        Map<Integer, Integer> dimensionDistribution
) {}
