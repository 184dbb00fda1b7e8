package com.openforge.mindstore.layer;

import java.util.List;
import java.util.Objects;

/**
 * Assignment of vector collections to one memory layer.
 *
 * @param retentionPriority 0.0 – 1.0, how strongly the layer should be preserved
 */
public record MemoryLayerMapping(
        MemoryLayer  layer,
        List<String> collections,
        String       description,
        double       retentionPriority
) {

    public MemoryLayerMapping {
        Objects.requireNonNull(layer, "layer");
        Objects.requireNonNull(description, "description");
        collections = List.copyOf(collections);
        if (Double.isNaN(retentionPriority) || retentionPriority < 0.0 || retentionPriority > 1.0) {
            throw new IllegalArgumentException("retentionPriority must be within [0, 1], got " + retentionPriority);
        }
    }

    public MemoryLayerMapping withCollections(List<String> replacement) {
        return new MemoryLayerMapping(layer, replacement, description, retentionPriority);
    }
}
