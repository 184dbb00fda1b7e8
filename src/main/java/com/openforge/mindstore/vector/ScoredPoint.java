package com.openforge.mindstore.vector;

import java.util.Map;

/**
 * A point returned by a nearest-neighbour search.
 *
 * @param id      backend primary key
 * @param score   similarity score reported by the backend
 * @param payload payload fields of the stored point (vector excluded)
 */
public record ScoredPoint(
        String              id,
        double              score,
        Map<String, Object> payload
) {}
