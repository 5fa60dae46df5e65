package com.fieldops.application.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * List parameters as the caller sent them. Filter keys are {@code field} or {@code field[op]}; each key may carry
 * several values, every one of which becomes its own condition.
 */
public record ListRequest(
        String search,
        Map<String, List<String>> filters,
        String sortBy,
        String sortOrder,
        int limit,
        int offset
) {
    public ListRequest {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (filters != null) filters.forEach((k, v) -> copy.put(k, v == null ? List.of() : List.copyOf(v)));
        filters = Collections.unmodifiableMap(copy);
    }

    public static ListRequest page(int limit, int offset) {
        return new ListRequest(null, Map.of(), null, null, limit, offset);
    }
}
