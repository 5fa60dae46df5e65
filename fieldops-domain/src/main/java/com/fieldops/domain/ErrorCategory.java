package com.fieldops.domain;

/**
 * Fixed error taxonomy surfaced to callers.
 */
public enum ErrorCategory {
    CONFIGURATION_ERROR("ConfigurationError"),
    PERMISSION_DENIED("PermissionDenied"),
    VALIDATION_FAILED("ValidationFailed"),
    CONFLICT_ERROR("ConflictError"),
    NOT_FOUND_REFERENCE("NotFoundReference"),
    DELETE_BLOCKED("DeleteBlocked");

    private final String code;

    ErrorCategory(String code) {
        this.code = code;
    }

    /** Stable wire name, e.g. {@code PermissionDenied}. */
    public String code() {
        return code;
    }
}
