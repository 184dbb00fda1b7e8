package com.openforge.mindstore.embedding;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The part of an /embeddings reply mindstore reads: the {@code data} items.
 * Model name, usage counters and the rest are ignored by the mapper.
 */
public record EmbeddingResponse(List<Item> data) {

    public record Item(int index, List<Float> embedding) {}

    /** Vector of the lowest-index item; servers are free to reorder {@code data}. */
    Optional<List<Float>> vector() {
        if (data == null) return Optional.empty();
        return data.stream()
                .filter(item -> item.embedding() != null && !item.embedding().isEmpty())
                .min(Comparator.comparingInt(Item::index))
                .map(Item::embedding);
    }
}
