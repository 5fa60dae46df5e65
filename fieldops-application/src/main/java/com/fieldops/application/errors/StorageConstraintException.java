package com.fieldops.application.errors;

import java.util.Objects;

/**
 * Raw constraint violation from a storage adapter. Never leaves the application layer untranslated.
 */
public class StorageConstraintException extends RuntimeException {

    private final ConstraintViolation violation;

    public StorageConstraintException(ConstraintViolation violation, Throwable cause) {
        super("Storage constraint violated: " + Objects.requireNonNull(violation, "violation").kind(), cause);
        this.violation = violation;
    }

    public ConstraintViolation violation() {
        return violation;
    }
}
