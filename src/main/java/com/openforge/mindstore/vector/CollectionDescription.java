package com.openforge.mindstore.vector;

/**
 * Raw collection metadata as reported by the backend.
 *
 * @param name        collection name
 * @param vectorSize  dimension of the vector field, 0 if unknown
 * @param pointsCount number of stored points
 * @param distance    index metric of the vector field
 * @param status      serving state
 */
public record CollectionDescription(
        String           name,
        int              vectorSize,
        long             pointsCount,
        Distance         distance,
        CollectionStatus status
) {}
