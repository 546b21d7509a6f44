package com.knowledge.importer.api;

import java.util.List;

/**
 * One window of a listing together with the size of the whole listing.
 *
 * @param content       the elements in this window
 * @param totalElements number of elements across all windows
 * @param request       the window that produced this page
 * @param <T>           element type
 */
public record Page<T>(List<T> content, long totalElements, PageRequest request) {

    public Page {
        content = content == null ? List.of() : List.copyOf(content);
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
    }

    /**
     * Cuts the window described by {@code request} out of an already-filtered, ordered list.
     */
    public static <T> Page<T> slice(List<T> all, PageRequest request) {
        int from = Math.min(request.offset(), all.size());
        int to = Math.min(request.offset() + request.limit(), all.size());
        return new Page<>(all.subList(from, to), all.size(), request);
    }

    public boolean hasNext() {
        return (long) request.offset() + content.size() < totalElements;
    }

    public int totalPages() {
        return (int) ((totalElements + request.limit() - 1) / request.limit());
    }
}
