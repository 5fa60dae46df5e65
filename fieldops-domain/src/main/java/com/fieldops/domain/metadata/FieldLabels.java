package com.fieldops.domain.metadata;

import java.util.Locale;

/**
 * Turns snake_case storage names into labels for user-facing messages.
 */
public final class FieldLabels {

    private FieldLabels() {
    }

    /** {@code invoice_number} becomes {@code Invoice number}; {@code customer_id} becomes {@code Customer}. */
    public static String humanize(String name) {
        if (name == null || name.isBlank()) return "Value";
        String n = name.trim();
        if (n.endsWith("_id") && n.length() > 3) {
            n = n.substring(0, n.length() - 3);
        }
        String spaced = n.replace('_', ' ').toLowerCase(Locale.ROOT).trim();
        if (spaced.isEmpty()) return "Value";
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }
}
