package com.openforge.mindstore.vector;

/**
 * Coarse serving state of a collection as reported by the backend.
 *
 * GREEN    : loaded and serving queries
 * YELLOW   : exists but is not (yet) loaded
 * RED      : exists but could not be described
 */
public enum CollectionStatus {
    GREEN,
    YELLOW,
    RED
}
