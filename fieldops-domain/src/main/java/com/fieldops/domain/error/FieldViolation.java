package com.fieldops.domain.error;

import java.util.Objects;

public record FieldViolation(String field, ViolationKind kind, String message) {
    public FieldViolation {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(kind, "kind");
        if (message == null || message.isBlank()) {
            message = field + " is invalid";
        }
    }
}
