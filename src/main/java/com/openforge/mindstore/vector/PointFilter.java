package com.openforge.mindstore.vector;

import java.util.ArrayList;
import java.util.List;

/**
 * Backend-neutral payload filter: every {@code must} condition has to hold and,
 * when present, at least one {@code should} condition has to hold.
 * Conditions are exact keyword matches on payload fields.
 */
public record PointFilter(
        List<Condition> must,
        List<Condition> should
) {

    public PointFilter {
        must   = List.copyOf(must);
        should = List.copyOf(should);
    }

    public record Condition(String key, String value) {}

    public static PointFilter matching(String key, String value) {
        return new PointFilter(List.of(new Condition(key, value)), List.of());
    }

    public static PointFilter anyOf(Condition... conditions) {
        return new PointFilter(List.of(), List.of(conditions));
    }

    public static Condition field(String key, String value) {
        return new Condition(key, value);
    }

    /** Returns a copy with one more mandatory condition. */
    public PointFilter and(String key, String value) {
        List<Condition> next = new ArrayList<>(must);
        next.add(new Condition(key, value));
        return new PointFilter(next, should);
    }

    public boolean isEmpty() {
        return must.isEmpty() && should.isEmpty();
    }
}
