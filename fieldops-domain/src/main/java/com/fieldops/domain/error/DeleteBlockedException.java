package com.fieldops.domain.error;

import com.fieldops.domain.DomainException;
import com.fieldops.domain.ErrorCategory;

import java.util.List;

/**
 * Delete refused because other records still reference the target.
 */
public final class DeleteBlockedException extends DomainException {

    private final String referencingTable;

    public DeleteBlockedException(String referencingTable, String message) {
        super(ErrorCategory.DELETE_BLOCKED, message, null,
                referencingTable == null ? List.of() : List.of(referencingTable));
        this.referencingTable = referencingTable;
    }

    public String referencingTable() {
        return referencingTable;
    }
}
