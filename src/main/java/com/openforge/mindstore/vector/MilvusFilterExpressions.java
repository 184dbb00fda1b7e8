package com.openforge.mindstore.vector;

import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@link PointFilter}s as Milvus boolean filter expressions.
 *
 * <pre>
 *   must   [session_id=s1, type=Decision]  →  session_id == "s1" and type == "Decision"
 *   should [source=x, target=x]            →  (source == "x" or target == "x")
 *   scroll after "k"                       →  ... and id > "k"
 * </pre>
 */
public final class MilvusFilterExpressions {

    /** Matches every row; Milvus requires a filter or a limit on scalar queries. */
    static final String MATCH_ALL = "id != \"\"";

    private MilvusFilterExpressions() {}

    @Nullable
    public static String render(@Nullable PointFilter filter) {
        if (filter == null || filter.isEmpty()) return null;

        List<String> parts = new ArrayList<>();
        for (PointFilter.Condition c : filter.must()) {
            parts.add(equality(c));
        }
        if (!filter.should().isEmpty()) {
            List<String> alternatives = new ArrayList<>();
            for (PointFilter.Condition c : filter.should()) {
                alternatives.add(equality(c));
            }
            String joined = String.join(" or ", alternatives);
            parts.add(alternatives.size() == 1 ? joined : "(" + joined + ")");
        }
        return String.join(" and ", parts);
    }

    /**
     * The filter restricted to rows whose key sorts after {@code afterKey}.
     * Without a key this is {@link #renderOrMatchAll}.
     */
    static String renderAfter(@Nullable PointFilter filter, String keyField, @Nullable String afterKey) {
        if (afterKey == null) return renderOrMatchAll(filter);
        String after = "%s > \"%s\"".formatted(keyField, escape(afterKey));
        String expr = render(filter);
        return expr == null ? after : expr + " and " + after;
    }

    /** Largest id of a full page, or null when the page is the last one. */
    @Nullable
    static String nextCursor(List<StoredPoint> page, int limit) {
        if (page.isEmpty() || page.size() < limit) return null;
        String max = page.get(0).id();
        for (StoredPoint p : page) {
            if (p.id().compareTo(max) > 0) max = p.id();
        }
        return max;
    }

    static String renderOrMatchAll(@Nullable PointFilter filter) {
        String expr = render(filter);
        return expr == null ? MATCH_ALL : expr;
    }

    private static String equality(PointFilter.Condition c) {
        return "%s == \"%s\"".formatted(c.key(), escape(c.value()));
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
