package com.fieldops.application.query;

import com.fieldops.domain.metadata.SortDirection;

import java.util.List;

/**
 * A list read as handed to a {@link com.fieldops.application.ports.RecordStore}: every column named here has
 * already been checked against the entity's whitelists and the caller's readable fields.
 *
 * <p>{@code search} is a trimmed term matched case-insensitively as a substring of any {@code searchFields}
 * column; filters are ANDed with it and with each other. A null {@code sortField} orders by primary key.
 * Rows that tie on the sort column are ordered by primary key.
 */
public record ListQuery(
        String search,
        List<String> searchFields,
        List<FilterCondition> filters,
        String sortField,
        SortDirection direction,
        int limit,
        int offset
) {
    public ListQuery {
        if (search != null && search.isBlank()) search = null;
        searchFields = searchFields == null ? List.of() : List.copyOf(searchFields);
        filters = filters == null ? List.of() : List.copyOf(filters);
        if (direction == null) direction = SortDirection.ASC;
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1");
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    }

    /** Unfiltered page in primary key order. */
    public static ListQuery page(int limit, int offset) {
        return new ListQuery(null, List.of(), List.of(), null, SortDirection.ASC, limit, offset);
    }

    public boolean hasSearch() {
        return search != null;
    }

    /** A search with no column left to look in cannot match any row. */
    public boolean matchesNothing() {
        return hasSearch() && searchFields.isEmpty();
    }
}
