package com.geography.sync.api;

import java.util.List;

/**
 * One page of a listing.
 *
 * @param totalElements size of the whole listing
 */
public record Page<T>(List<T> content, long totalElements, int pageNumber, int pageSize) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    /**
     * Cuts the page described by {@code request} out of a complete, already ordered list.
     */
    public static <T> Page<T> slice(List<T> all, PageRequest request) {
        int from = Math.min(request.offset(), all.size());
        int to = Math.min(from + request.limit(), all.size());
        return new Page<>(all.subList(from, to), all.size(), request.pageNumber(), request.limit());
    }

    public static <T> Page<T> empty(PageRequest request) {
        return new Page<>(List.of(), 0, request.pageNumber(), request.limit());
    }

    public boolean hasNext() {
        return (long) (pageNumber + 1) * pageSize < totalElements;
    }

    public int totalPages() {
        return pageSize == 0 ? 0 : (int) Math.ceil((double) totalElements / pageSize);
    }

    public boolean hasContent() {
        return !content.isEmpty();
    }
}
