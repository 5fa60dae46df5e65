package com.fieldops.application.errors;

import java.util.Objects;

/**
 * Engine-neutral view of a rejected write. Every text field besides {@code kind} is best effort and may be null.
 *
 * @param detail engine detail line, e.g. {@code Key (customer_id)=(9) is not present in table "customers".}
 */
public record ConstraintViolation(
        ConstraintKind kind,
        String sqlState,
        String message,
        String detail,
        String constraintName,
        String columnName,
        String tableName
) {
    public ConstraintViolation {
        Objects.requireNonNull(kind, "kind");
    }

    public static ConstraintViolation of(ConstraintKind kind, String message, String detail) {
        return new ConstraintViolation(kind, null, message, detail, null, null, null);
    }
}
