package com.openforge.mindstore.thought;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of reasoning step a thought represents.
 *
 * A closed set of tags the engine understands ({@link Known}) plus an
 * {@link Other} escape hatch, so tags introduced by callers survive a
 * write/read cycle unchanged.
 */
public sealed interface ThoughtType permits ThoughtType.Known, ThoughtType.Other {

    /** Wire form, stored in the {@code type} payload field. */
    String tag();

    /**
     * Parses a tag. Known tags match case-insensitively and come back in their
     * canonical spelling; anything else becomes {@link Other} verbatim.
     */
    static ThoughtType of(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Thought type must not be blank");
        }
        String wanted = tag.trim().toLowerCase(Locale.ROOT);
        for (Known known : Known.values()) {
            if (known.tag.toLowerCase(Locale.ROOT).equals(wanted)) return known;
        }
        return new Other(tag);
    }

    enum Known implements ThoughtType {
        OBSERVATION("Observation"),
        ANALYTICAL("Analytical"),
        DECISION("Decision"),
        EMOTIONAL("Emotional"),
        SELF_REFLECTION("SelfReflection"),
        MEMORY_RECALL("MemoryRecall"),
        STRATEGIC("Strategic"),
        SYNTHESIS("Synthesis"),
        CREATIVE("Creative");

        private final String tag;

        Known(String tag) {
            this.tag = tag;
        }

        @JsonValue
        @Override
        public String tag() {
            return tag;
        }
    }

    record Other(String tag) implements ThoughtType {

        @JsonValue
        @Override
        public String tag() {
            return tag;
        }
    }
}
