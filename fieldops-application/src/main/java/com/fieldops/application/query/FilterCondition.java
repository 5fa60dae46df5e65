package com.fieldops.application.query;

import java.util.List;
import java.util.Objects;

/**
 * One filter with its values already converted to the column's Java type. Only {@link FilterOperator#IN} carries
 * more than one value.
 */
public record FilterCondition(String field, FilterOperator operator, List<Object> values) {
    public FilterCondition {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        values = List.copyOf(values);
        if (values.isEmpty()) throw new IllegalArgumentException("filter on " + field + " has no value");
        if (operator != FilterOperator.IN && values.size() != 1) {
            throw new IllegalArgumentException(operator.key() + " filter on " + field + " takes one value");
        }
    }

    public static FilterCondition of(String field, FilterOperator operator, Object value) {
        return new FilterCondition(field, operator, List.of(value));
    }

    public Object value() {
        return values.get(0);
    }
}
