package com.fieldops.domain.error;

import java.util.Locale;

/**
 * Kind of a single field-level validation failure. Custom messages in metadata are keyed by these.
 */
public enum ViolationKind {
    REQUIRED,
    TYPE,
    FORMAT,
    LENGTH,
    PATTERN,
    ENUM,
    RANGE,
    IMMUTABLE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ViolationKind fromKey(String key) {
        if (key == null) throw new IllegalArgumentException("violation kind is null");
        String k = key.trim().toUpperCase(Locale.ROOT);
        // metadata documents key bound messages by the bound name
        if (k.equals("MINLENGTH") || k.equals("MAXLENGTH")) return LENGTH;
        if (k.equals("MIN") || k.equals("MAX")) return RANGE;
        return ViolationKind.valueOf(k);
    }
}
