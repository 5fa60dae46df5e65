package com.fieldops.application.validation;

import com.fieldops.domain.error.FieldViolation;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @param value    accepted fields with coerced values; unknown fields are not in it
 * @param stripped payload fields the schema does not know
 */
public record ValidationResult(Map<String, Object> value, List<FieldViolation> violations, Set<String> stripped) {
    public ValidationResult {
        violations = List.copyOf(violations);
        stripped = Set.copyOf(stripped);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }
}
