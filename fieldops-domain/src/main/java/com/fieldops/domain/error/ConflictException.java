package com.fieldops.domain.error;

import com.fieldops.domain.DomainException;
import com.fieldops.domain.ErrorCategory;

import java.util.List;

/**
 * A uniqueness rule rejected the write (duplicate value or identifier collision).
 */
public final class ConflictException extends DomainException {

    public ConflictException(String field, String message) {
        super(ErrorCategory.CONFLICT_ERROR, message, field, List.of());
    }
}
