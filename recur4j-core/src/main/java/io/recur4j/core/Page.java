package io.recur4j.core;

import java.util.List;

/**
 * One page of a listing.
 *
 * items    : rows on this page
 * total    : number of rows matched overall
 * page     : 1-based page number
 * pageSize : requested page size
 */
public record Page<T>(
        List<T> items,
        long total,
        int page,
        int pageSize
) {

    public Page {
        items = List.copyOf(items);
    }

    public static <T> Page<T> empty(int page, int pageSize) {
        return new Page<>(List.of(), 0, page, pageSize);
    }

    public int pages() {
        return pageSize <= 0 ? 0 : (int) ((total + pageSize - 1) / pageSize);
    }

    public boolean hasNext() {
        return page < pages();
    }

    public boolean hasPrevious() {
        return page > 1;
    }

    /**
     * Slice an already ordered list into a page.
     */
    public static <T> Page<T> of(List<T> ordered, int page, int pageSize) {
        long offset = (long) (page - 1) * pageSize;
        if (offset >= ordered.size()) {
            return new Page<>(List.of(), ordered.size(), page, pageSize);
        }
        int from = (int) offset;
        int to = (int) Math.min(ordered.size(), offset + pageSize);
        return new Page<>(ordered.subList(from, to), ordered.size(), page, pageSize);
    }
}
