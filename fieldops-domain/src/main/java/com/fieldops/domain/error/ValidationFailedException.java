package com.fieldops.domain.error;

import com.fieldops.domain.DomainException;
import com.fieldops.domain.ErrorCategory;

import java.util.List;

/**
 * Type, format or range problem with caller input, or a storage check that rejected a value.
 */
public final class ValidationFailedException extends DomainException {

    private final List<FieldViolation> violations;

    public ValidationFailedException(List<FieldViolation> violations) {
        super(ErrorCategory.VALIDATION_FAILED,
                violations.isEmpty() ? "Validation failed" : violations.get(0).message(),
                violations.isEmpty() ? null : violations.get(0).field(),
                violations.stream().map(FieldViolation::message).toList());
        this.violations = List.copyOf(violations);
    }

    public ValidationFailedException(String field, String message) {
        super(ErrorCategory.VALIDATION_FAILED, message, field, List.of());
        this.violations = field == null
                ? List.of()
                : List.of(new FieldViolation(field, ViolationKind.FORMAT, message));
    }

    public List<FieldViolation> violations() {
        return violations;
    }
}
