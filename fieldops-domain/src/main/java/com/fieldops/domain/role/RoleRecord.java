package com.fieldops.domain.role;

import java.util.Locale;
import java.util.Objects;

public record RoleRecord(String name, int priority) {
    public RoleRecord {
        Objects.requireNonNull(name, "name");
        name = name.trim().toLowerCase(Locale.ROOT);
        if (name.isEmpty()) throw new IllegalArgumentException("role name is blank");
    }

    public static RoleRecord of(String name, int priority) {
        return new RoleRecord(name, priority);
    }
}
