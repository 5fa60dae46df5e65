package com.fieldops.application.validation;

import com.fieldops.domain.metadata.FieldDef;
import com.fieldops.domain.metadata.SemanticType;

import java.util.Objects;
import java.util.function.Function;

/**
 * Registry entry for one semantic type.
 *
 * @param baseRule   builds the type's own check from the field definition (format, coercion, membership)
 * @param normalizer hygiene applied before validation
 */
public record TypeBuilder(
        SemanticType type,
        TypeFamily family,
        Function<FieldDef, FieldRule> baseRule,
        ValueNormalizer normalizer
) {
    public TypeBuilder {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(baseRule, "baseRule");
        if (normalizer == null) normalizer = ValueNormalizer.IDENTITY;
    }

    public static TypeBuilder of(SemanticType type, TypeFamily family, Function<FieldDef, FieldRule> baseRule,
                                 ValueNormalizer normalizer) {
        return new TypeBuilder(type, family, baseRule, normalizer);
    }
}
