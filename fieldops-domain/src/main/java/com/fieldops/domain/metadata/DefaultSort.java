package com.fieldops.domain.metadata;

import java.util.Objects;

/**
 * Order applied to list reads that name no usable sort field.
 */
public record DefaultSort(String field, SortDirection direction) {
    public DefaultSort {
        Objects.requireNonNull(field, "field");
        if (field.isBlank()) throw new IllegalArgumentException("default sort field is blank");
        if (direction == null) direction = SortDirection.ASC;
    }
}
