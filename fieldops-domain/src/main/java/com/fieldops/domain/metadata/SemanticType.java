package com.fieldops.domain.metadata;

import java.util.Locale;

/**
 * Fixed set of field types a metadata document may declare.
 */
public enum SemanticType {
    STRING("string"),
    TEXT("text"),
    EMAIL("email"),
    PHONE("phone"),
    URL("url"),
    INTEGER("integer"),
    DECIMAL("decimal"),
    CURRENCY("currency"),
    BOOLEAN("boolean"),
    DATE("date"),
    TIME("time"),
    TIMESTAMP("timestamp"),
    ENUM("enum"),
    OBJECT("object");

    private final String tag;

    SemanticType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * @throws IllegalArgumentException for an unknown tag
     */
    public static SemanticType fromTag(String tag) {
        if (tag == null) throw new IllegalArgumentException("type tag is null");
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (SemanticType st : values()) {
            if (st.tag.equals(t)) return st;
        }
        throw new IllegalArgumentException("Unknown field type: " + tag);
    }
}
