package com.fieldops.domain.error;

import com.fieldops.domain.DomainException;
import com.fieldops.domain.ErrorCategory;

import java.util.List;

/**
 * A foreign key on insert/update points at a record that does not exist.
 */
public final class NotFoundReferenceException extends DomainException {

    private final String referencedEntity;

    public NotFoundReferenceException(String field, String referencedEntity, String message) {
        super(ErrorCategory.NOT_FOUND_REFERENCE, message, field, List.of());
        this.referencedEntity = referencedEntity;
    }

    public String referencedEntity() {
        return referencedEntity;
    }
}
