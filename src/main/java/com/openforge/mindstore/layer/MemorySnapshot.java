package com.openforge.mindstore.layer;

import com.openforge.mindstore.admin.CollectionInfo;
import com.openforge.mindstore.admin.CollectionLink;
import com.openforge.mindstore.admin.MemoryStatistics;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time description of the memory architecture. Metadata only,
 * no vectors are copied.
 */
public record MemorySnapshot(
        Instant                 timestamp,
        List<CollectionInfo>    collections,
        List<CollectionLink>    links,
        Map<MemoryLayer, Long>  layerVectorCounts,
        MemoryStatistics        statistics
) {}
