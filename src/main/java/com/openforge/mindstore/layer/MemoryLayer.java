package com.openforge.mindstore.layer;

import java.util.Locale;

/**
 * Cognitive memory layers the collections are grouped into.
 */
public enum MemoryLayer {
    /** Active thought processes and immediate reasoning. */
    WORKING,
    /** Recent interactions and their outcomes. */
    EPISODIC,
    /** Learned facts, concepts and domain knowledge. */
    SEMANTIC,
    /** Skills, tool usage patterns and procedures. */
    PROCEDURAL,
    /** Self-model, identity and known entities. */
    AUTOBIOGRAPHICAL;

    public static MemoryLayer parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown memory layer: " + value, e);
        }
    }
}
