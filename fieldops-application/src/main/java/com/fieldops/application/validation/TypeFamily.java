package com.fieldops.application.validation;

/**
 * Decides which modifier layer applies on top of a type's base rule.
 */
public enum TypeFamily {
    /** Length, pattern, trim/case directives, value lists. */
    STRING,
    /** min/max. */
    NUMERIC,
    /** Base rule only. */
    OTHER
}
