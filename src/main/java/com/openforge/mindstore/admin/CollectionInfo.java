package com.openforge.mindstore.admin;

import com.openforge.mindstore.vector.CollectionStatus;
import com.openforge.mindstore.vector.Distance;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Administrative view of one vector collection.
 *
 * @param purpose           description from the known-collection registry, if any
 * @param linkedCollections names on the other end of links touching this collection
 */
public record CollectionInfo(
        String           name,
        int              vectorSize,
        long             pointsCount,
        Distance         distanceMetric,
        CollectionStatus status,
        @Nullable String purpose,
        List<String>     linkedCollections
) {

    public CollectionInfo {
        linkedCollections = linkedCollections == null ? List.of() : List.copyOf(linkedCollections);
    }

    public boolean isGreen() {
        return status == CollectionStatus.GREEN;
    }
}
