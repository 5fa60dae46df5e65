package com.fieldops.domain.metadata;

import java.util.Objects;

/**
 * Target of a foreign-key field; {@code displayName} is what error messages call the referenced record.
 */
public record ForeignKeyRef(String table, String displayName) {
    public ForeignKeyRef {
        Objects.requireNonNull(table, "table");
        if (table.isBlank()) throw new IllegalArgumentException("table is blank");
        if (displayName == null || displayName.isBlank()) {
            displayName = FieldLabels.humanize(table);
        }
    }
}
