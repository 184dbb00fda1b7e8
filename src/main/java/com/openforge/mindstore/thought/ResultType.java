package com.openforge.mindstore.thought;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Kind of outcome recorded against a thought.
 */
public enum ResultType {
    ACTION("action"),
    RESPONSE("response"),
    INSIGHT("insight"),
    DECISION("decision"),
    SKILL_LEARNED("skill_learned"),
    FACT_DISCOVERED("fact_discovered"),
    ERROR("error"),
    DEFERRED("deferred");

    private final String wire;

    ResultType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public static Optional<ResultType> fromWire(String value) {
        for (ResultType t : values()) {
            if (t.wire.equalsIgnoreCase(value)) return Optional.of(t);
        }
        return Optional.empty();
    }

    public static ResultType parse(String value) {
        return fromWire(value).orElseThrow(
                () -> new IllegalArgumentException("Unknown result type: " + value));
    }
}
