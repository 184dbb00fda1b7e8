package com.openforge.mindstore.thought;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Closed vocabulary of typed edges between thoughts.
 */
public enum RelationType {
    CAUSED_BY("caused_by"),
    LEADS_TO("leads_to"),
    CONTRADICTS("contradicts"),
    SUPPORTS("supports"),
    REFINES("refines"),
    ABSTRACTS("abstracts"),
    ELABORATES("elaborates"),
    SIMILAR_TO("similar_to"),
    INSTANCE_OF("instance_of"),
    PART_OF("part_of"),
    TRIGGERS("triggers"),
    RESOLVES("resolves");

    private final String wire;

    RelationType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public static Optional<RelationType> fromWire(String value) {
        for (RelationType t : values()) {
            if (t.wire.equalsIgnoreCase(value)) return Optional.of(t);
        }
        return Optional.empty();
    }

    public static RelationType parse(String value) {
        return fromWire(value).orElseThrow(
                () -> new IllegalArgumentException("Unknown relation type: " + value));
    }
}
