package com.openforge.mindstore.thought;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What produced a thought: a reaction to input, the agent's own initiative,
 * or a continuation of an earlier thought. {@link Other} keeps unknown
 * origins intact.
 */
public sealed interface ThoughtOrigin permits ThoughtOrigin.Known, ThoughtOrigin.Other {

    String tag();

    static ThoughtOrigin of(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Thought origin must not be blank");
        }
        String wanted = tag.trim().toLowerCase(Locale.ROOT);
        for (Known known : Known.values()) {
            if (known.tag.toLowerCase(Locale.ROOT).equals(wanted)) return known;
        }
        return new Other(tag);
    }

    enum Known implements ThoughtOrigin {
        REACTIVE("Reactive"),
        AUTONOMOUS("Autonomous"),
        CHAINED("Chained");

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

    record Other(String tag) implements ThoughtOrigin {

        @JsonValue
        @Override
        public String tag() {
            return tag;
        }
    }
}
