package com.openforge.mindstore.vector;

/**
 * Similarity metric a collection is indexed with.
 *
 * COSINE   : angle between vectors, independent of magnitude
 * DOT      : inner product (equals cosine for L2-normalized embeddings)
 * EUCLID   : L2 distance
 */
public enum Distance {
    COSINE,
    DOT,
    EUCLID
}
