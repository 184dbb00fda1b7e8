package com.openforge.mindstore.admin;

import org.springframework.lang.Nullable;

/**
 * Health of one collection against the expected embedding dimension.
 * Healthy means no dimension mismatch and status GREEN.
 */
public record CollectionHealthReport(
        String           collectionName,
        boolean          healthy,
        int              expectedDimension,
        int              actualDimension,
        boolean          dimensionMismatch,
        @Nullable String issue,
        @Nullable String recommendation
) {

    static CollectionHealthReport of(CollectionInfo info, int expectedDimension) {
        boolean mismatch = info.vectorSize() > 0 && info.vectorSize() != expectedDimension;
        return new CollectionHealthReport(
                info.name(),
                !mismatch && info.isGreen(),
                expectedDimension,
                info.vectorSize(),
                mismatch,
                mismatch ? "Dimension mismatch: expected " + expectedDimension + ", got " + info.vectorSize() : null,
                mismatch ? "Delete and recreate the collection, or migrate its vectors to "
                        + expectedDimension + " dimensions" : null);
    }
}
