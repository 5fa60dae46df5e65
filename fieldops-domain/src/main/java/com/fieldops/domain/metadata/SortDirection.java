package com.fieldops.domain.metadata;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    /** Case-insensitive; anything other than asc or desc yields {@code fallback}. */
    public static SortDirection parse(String value, SortDirection fallback) {
        if (value == null) return fallback;
        String v = value.trim().toUpperCase(Locale.ROOT);
        if (v.equals("ASC")) return ASC;
        if (v.equals("DESC")) return DESC;
        return fallback;
    }
}
