package com.fieldops.domain.metadata;

import java.util.Locale;
import java.util.Objects;

/**
 * Minimum role per operation, or {@link #NONE} when nobody may perform it.
 * Used both for a field's access entry and for entity-level permissions.
 */
public record CrudAccess(String create, String read, String update, String delete) {

    public static final String NONE = "none";

    public static final CrudAccess DENY_ALL = new CrudAccess(NONE, NONE, NONE, NONE);

    public CrudAccess {
        create = normalize(create);
        read = normalize(read);
        update = normalize(update);
        delete = normalize(delete);
    }

    public static CrudAccess of(String create, String read, String update, String delete) {
        return new CrudAccess(create, read, update, delete);
    }

    public static CrudAccess readOnly(String read) {
        return new CrudAccess(NONE, read, NONE, NONE);
    }

    public String requirementFor(Operation op) {
        Objects.requireNonNull(op, "op");
        return switch (op) {
            case CREATE -> create;
            case READ -> read;
            case UPDATE -> update;
            case DELETE -> delete;
        };
    }

    public static boolean isNone(String requirement) {
        return requirement == null || NONE.equals(requirement);
    }

    // missing entries mean "nobody"
    private static String normalize(String v) {
        if (v == null || v.isBlank()) return NONE;
        return v.trim().toLowerCase(Locale.ROOT);
    }
}
