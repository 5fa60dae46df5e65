package com.fieldops.application.query;

import java.util.Locale;

/**
 * Comparison a list filter applies. Written as {@code field[op]=value}; a bare {@code field=value} is {@link #EQ}.
 */
public enum FilterOperator {
    EQ,
    NOT,
    GT,
    GTE,
    LT,
    LTE,
    /** Comma-separated values, any of which may match. */
    IN;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Null for an unknown key. */
    public static FilterOperator fromKey(String key) {
        if (key == null) return null;
        for (FilterOperator op : values()) {
            if (op.key().equals(key.trim().toLowerCase(Locale.ROOT))) return op;
        }
        return null;
    }
}
