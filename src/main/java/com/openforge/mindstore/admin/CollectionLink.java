package com.openforge.mindstore.admin;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * Directed, typed edge between two collections in the memory architecture.
 *
 * @param strength 0.0 – 1.0, defaults to 1.0
 */
public record CollectionLink(
        String           sourceCollection,
        String           targetCollection,
        LinkType         relationType,
        double           strength,
        @Nullable String description
) {

    public CollectionLink {
        Objects.requireNonNull(sourceCollection, "sourceCollection");
        Objects.requireNonNull(targetCollection, "targetCollection");
        Objects.requireNonNull(relationType, "relationType");
        if (Double.isNaN(strength) || strength < 0.0 || strength > 1.0) {
            throw new IllegalArgumentException("strength must be within [0, 1], got " + strength);
        }
    }

    public CollectionLink(String source, String target, LinkType relationType) {
        this(source, target, relationType, 1.0, null);
    }

    public boolean touches(String collection) {
        return sourceCollection.equals(collection) || targetCollection.equals(collection);
    }

    public boolean sameEdge(CollectionLink other) {
        return sourceCollection.equals(other.sourceCollection)
                && targetCollection.equals(other.targetCollection)
                && relationType == other.relationType;
    }

    public enum LinkType {
        DEPENDS_ON("depends_on"),
        INDEXES("indexes"),
        EXTENDS("extends"),
        MIRRORS("mirrors"),
        AGGREGATES("aggregates"),
        PART_OF("part_of"),
        RELATED_TO("related_to");

        private final String wire;

        LinkType(String wire) {
            this.wire = wire;
        }

        @JsonValue
        public String wire() {
            return wire;
        }

        public static Optional<LinkType> fromWire(String value) {
            for (LinkType t : values()) {
                if (t.wire.equalsIgnoreCase(value)) return Optional.of(t);
            }
            return Optional.empty();
        }

        public static LinkType parse(String value) {
            return fromWire(value).orElseThrow(
                    () -> new IllegalArgumentException("Unknown collection link type: " + value));
        }
    }
}
