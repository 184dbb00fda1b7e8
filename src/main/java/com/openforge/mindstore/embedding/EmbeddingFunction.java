package com.openforge.mindstore.embedding;

import java.util.List;

/**
 * Text → fixed-length float vector.
 *
 * Optional collaborator: when no bean is present the thought store falls back
 * to substring search and relation inference is skipped.
 */
@FunctionalInterface
public interface EmbeddingFunction {

    List<Float> embed(String text);
}
