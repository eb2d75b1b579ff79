package com.fedivotes.domain.model;

import java.util.List;

/**
 * One page of an ordered result list.
 *
 * @param items      the page, at most {@code limit} elements
 * @param totalCount size of the full list the page was cut from
 * @param nextOffset offset of the following page, or null when this is the last one
 */
public record OffsetPage<T>(
    List<T> items,
    int totalCount,
    Integer nextOffset
) {
    public OffsetPage {
        items = List.copyOf(items);
    }

    /**
     * Cuts {@code all[offset, offset + limit)} out of the full list.
     * An offset that is negative or past the end yields an empty page with no next offset.
     *
     * @throws IllegalArgumentException if {@code limit < 1}
     */
    public static <T> OffsetPage<T> slice(List<T> all, int offset, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, was " + limit);
        }
        int total = all.size();
        if (offset < 0 || offset >= total) {
            return empty(total);
        }
        int end = (int) Math.min((long) offset + limit, total);
        Integer next = end < total ? end : null;
        return new OffsetPage<>(all.subList(offset, end), total, next);
    }

    public static <T> OffsetPage<T> empty(int totalCount) {
        return new OffsetPage<>(List.of(), totalCount, null);
    }
}
