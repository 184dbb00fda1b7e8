package com.openforge.mindstore.vector;

import java.util.Map;

/**
 * A point returned by a scroll (scalar query): no score, no vector.
 */
public record StoredPoint(
        String              id,
        Map<String, Object> payload
) {}
