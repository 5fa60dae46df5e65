package com.fieldops.domain.error;

import com.fieldops.domain.DomainException;
import com.fieldops.domain.ErrorCategory;

import java.util.List;

/**
 * The caller's role may not touch one or more fields (or the entity operation itself).
 * {@link #deniedFields()} always lists every offending field, never only the first.
 */
public final class PermissionDeniedException extends DomainException {

    private final String role;
    private final String operation;

    public PermissionDeniedException(String role, String operation, List<String> deniedFields) {
        super(ErrorCategory.PERMISSION_DENIED,
                "Access denied: role '" + role + "' cannot " + operation + " field(s): " + String.join(", ", deniedFields),
                deniedFields.isEmpty() ? null : deniedFields.get(0),
                deniedFields);
        this.role = role;
        this.operation = operation;
    }

    private PermissionDeniedException(String role, String operation, String message) {
        super(ErrorCategory.PERMISSION_DENIED, message, null, List.of());
        this.role = role;
        this.operation = operation;
    }

    public static PermissionDeniedException forEntity(String role, String operation, String entityName) {
        return new PermissionDeniedException(role, operation,
                "Access denied: role '" + role + "' cannot " + operation + " " + entityName);
    }

    public String role() {
        return role;
    }

    public String operation() {
        return operation;
    }

    public List<String> deniedFields() {
        return details();
    }
}
