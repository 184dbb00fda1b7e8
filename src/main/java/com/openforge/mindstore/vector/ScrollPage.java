package com.openforge.mindstore.vector;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * One page of a scroll.
 *
 * @param points     the points of this page
 * @param nextCursor opaque cursor for the next page, null when exhausted
 */
public record ScrollPage(
        List<StoredPoint> points,
        @Nullable String  nextCursor
) {

    public static ScrollPage empty() {
        return new ScrollPage(List.of(), null);
    }

    public boolean hasNext() {
        return nextCursor != null;
    }
}
