package com.pcat.store;

/**
 * Paging and search options for browsing the catalog.
 *
 * @param query case-insensitive substring of the identifier; null/blank = all
 * @param page  1-based page number
 * @param size  page size, clamped to 1..{@value #MAX_SIZE}
 */
public record PluginFilter(String query, int page, int size) {

    public static final int DEFAULT_SIZE = 30;
    public static final int MAX_SIZE = 100;

    public PluginFilter {
        query = query != null && !query.isBlank() ? query.trim() : null;
        page = Math.max(1, page);
        size = size <= 0 ? DEFAULT_SIZE : Math.min(size, MAX_SIZE);
    }

    public static PluginFilter all() {
        return new PluginFilter(null, 1, DEFAULT_SIZE);
    }

    public static PluginFilter query(String query) {
        return new PluginFilter(query, 1, DEFAULT_SIZE);
    }

    public int offset() {
        return (page - 1) * size;
    }

    /** Whether the given identifier passes the query part of this filter. */
    public boolean accepts(String identifier) {
        return query == null || (identifier != null && identifier.toLowerCase().contains(query.toLowerCase()));
    }
}
