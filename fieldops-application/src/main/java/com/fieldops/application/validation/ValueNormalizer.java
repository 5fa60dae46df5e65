package com.fieldops.application.validation;

import java.util.Locale;

/**
 * Type-driven cleanup applied to raw input before validation. Must be idempotent.
 */
@FunctionalInterface
public interface ValueNormalizer {

    Object normalize(Object value);

    ValueNormalizer IDENTITY = v -> v;

    ValueNormalizer TRIM = v -> v instanceof String s ? s.trim() : v;

    ValueNormalizer TRIM_LOWERCASE = v -> v instanceof String s ? s.trim().toLowerCase(Locale.ROOT) : v;
}
