package com.openforge.mindstore.layer;

import com.openforge.mindstore.admin.MemoryStatistics;

import java.util.List;

/**
 * Outcome of a memory-wide health check, optionally with auto-heal.
 */
public record MemoryHealthReport(
        int              healthyCollections,
        int              unhealthyCollections,
        List<String>     healedCollections,
        List<String>     unhealthyCollectionNames,
        MemoryStatistics statistics
) {}
