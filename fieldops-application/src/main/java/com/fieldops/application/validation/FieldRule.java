package com.fieldops.application.validation;

import java.util.Objects;

/**
 * One composable check over a non-empty field value.
 */
@FunctionalInterface
public interface FieldRule {

    RuleOutcome check(String field, Object value);

    /** Runs {@code next} on this rule's accepted value; the first failure wins. */
    default FieldRule andThen(FieldRule next) {
        Objects.requireNonNull(next, "next");
        return (field, value) -> {
            RuleOutcome first = check(field, value);
            return first.isOk() ? next.check(field, first.value()) : first;
        };
    }

    static FieldRule accept() {
        return (field, value) -> RuleOutcome.ok(value);
    }
}
