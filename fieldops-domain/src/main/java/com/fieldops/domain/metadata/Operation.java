package com.fieldops.domain.metadata;

import java.util.Locale;

public enum Operation {
    CREATE,
    READ,
    UPDATE,
    DELETE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Operation fromKey(String key) {
        if (key == null) throw new IllegalArgumentException("operation is null");
        return Operation.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
