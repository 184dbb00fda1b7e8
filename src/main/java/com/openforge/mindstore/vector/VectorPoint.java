package com.openforge.mindstore.vector;

import java.util.List;
import java.util.Map;

/**
 * A point to upsert: caller-assigned id, embedding vector and flat payload.
 *
 * @param id      UUID string, used directly as the backend primary key
 * @param vector  embedding, length must match the collection dimension
 * @param payload scalar payload fields (String / Number / Boolean)
 */
public record VectorPoint(
        String              id,
        List<Float>         vector,
        Map<String, Object> payload
) {}
