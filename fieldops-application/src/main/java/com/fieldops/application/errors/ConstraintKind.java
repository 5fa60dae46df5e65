package com.fieldops.application.errors;

/**
 * Storage constraint families, assigned by the adapter that caught the engine error.
 */
public enum ConstraintKind {
    FOREIGN_KEY,
    UNIQUE,
    CHECK,
    NOT_NULL,
    INVALID_DATETIME,
    NUMERIC_OUT_OF_RANGE,
    INVALID_TEXT_REPRESENTATION,
    UNKNOWN
}
