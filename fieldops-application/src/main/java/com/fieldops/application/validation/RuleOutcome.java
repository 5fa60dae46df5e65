package com.fieldops.application.validation;

import com.fieldops.domain.error.ViolationKind;

import java.util.Objects;

/**
 * Result of one rule: either the accepted (possibly coerced) value, or a violation.
 */
public final class RuleOutcome {

    private final Object value;
    private final ViolationKind kind;
    private final String message;

    private RuleOutcome(Object value, ViolationKind kind, String message) {
        this.value = value;
        this.kind = kind;
        this.message = message;
    }

    public static RuleOutcome ok(Object value) {
        return new RuleOutcome(value, null, null);
    }

    public static RuleOutcome fail(ViolationKind kind, String message) {
        return new RuleOutcome(null, Objects.requireNonNull(kind, "kind"), message);
    }

    public boolean isOk() {
        return kind == null;
    }

    public Object value() {
        return value;
    }

    public ViolationKind kind() {
        return kind;
    }

    public String message() {
        return message;
    }

    RuleOutcome withMessage(String text) {
        return isOk() ? this : new RuleOutcome(null, kind, text);
    }
}
