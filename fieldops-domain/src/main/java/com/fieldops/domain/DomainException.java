package com.fieldops.domain;

import java.util.List;
import java.util.Objects;

/**
 * Base class for every error the core raises on purpose.
 *
 * Each subclass fixes its {@link ErrorCategory}; callers never infer the category from the message text.
 */
public abstract class DomainException extends RuntimeException {

    private final ErrorCategory category;
    private final String field;
    private final List<String> details;

    protected DomainException(ErrorCategory category, String message, String field, List<String> details) {
        super(message);
        this.category = Objects.requireNonNull(category, "category");
        this.field = field;
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public ErrorCategory category() {
        return category;
    }

    /** Offending field, when the error is scoped to one. */
    public String field() {
        return field;
    }

    public List<String> details() {
        return details;
    }
}
