package com.fieldops.application.hygiene;

import com.fieldops.application.validation.TypeBuilderRegistry;
import com.fieldops.domain.metadata.EntityMetadata;
import com.fieldops.domain.metadata.FieldDef;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Type-driven cleanup of raw input, run before validation so stray whitespace never fails a length or format check.
 *
 * The per-type normalizer comes from the {@link TypeBuilderRegistry}: string/text/phone trim, email/enum trim and
 * lowercase, everything else passes through.
 */
public class DataHygiene {

    private final TypeBuilderRegistry registry;

    public DataHygiene(TypeBuilderRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Object sanitizeValue(Object value, FieldDef def) {
        if (value == null) return null;
        if (def == null) {
            return value instanceof String s ? s.trim() : value;
        }
        return registry.builderFor(def.type()).normalizer().normalize(value);
    }

    /** New map with every value sanitized against its field definition; keys are kept as given. */
    public Map<String, Object> sanitizePayload(Map<String, Object> payload, EntityMetadata metadata) {
        if (payload == null) return Map.of();
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : payload.entrySet()) {
            out.put(e.getKey(), sanitizeValue(e.getValue(), metadata.field(e.getKey())));
        }
        return out;
    }

    /** Null and whitespace-only strings are empty. */
    public static boolean isEmpty(Object value) {
        if (value == null) return true;
        return value instanceof String s && s.isBlank();
    }
}
