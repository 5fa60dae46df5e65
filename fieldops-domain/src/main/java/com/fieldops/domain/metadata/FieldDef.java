package com.fieldops.domain.metadata;

import com.fieldops.domain.error.ViolationKind;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of one field: semantic type plus optional constraints.
 *
 * <p>{@code trim} and {@code lowercase} are explicit directives for string-class fields, on top of what the
 * type already implies. {@code positive} requires a numeric value strictly above zero. {@code messages} override the default text for a violation kind.
 */
public record FieldDef(
        SemanticType type,
        boolean required,
        BigDecimal min,
        BigDecimal max,
        Integer minLength,
        Integer maxLength,
        String pattern,
        List<String> values,
        Object defaultValue,
        boolean trim,
        boolean lowercase,
        boolean positive,
        Map<ViolationKind, String> messages
) {
    public FieldDef {
        Objects.requireNonNull(type, "type");
        values = values == null ? List.of() : List.copyOf(values);
        messages = messages == null || messages.isEmpty() ? Map.of() : Map.copyOf(messages);
        if (minLength != null && minLength < 0) throw new IllegalArgumentException("minLength < 0");
        if (maxLength != null && maxLength < 0) throw new IllegalArgumentException("maxLength < 0");
        if (minLength != null && maxLength != null && minLength > maxLength) {
            throw new IllegalArgumentException("minLength > maxLength");
        }
        if (min != null && max != null && min.compareTo(max) > 0) {
            throw new IllegalArgumentException("min > max");
        }
    }

    public static FieldDef of(SemanticType type) {
        return builder(type).build();
    }

    public static Builder builder(SemanticType type) {
        return new Builder(type);
    }

    public boolean hasValues() {
        return !values.isEmpty();
    }

    public String messageFor(ViolationKind kind) {
        return messages.get(kind);
    }

    public static final class Builder {
        private final SemanticType type;
        private boolean required;
        private BigDecimal min;
        private BigDecimal max;
        private Integer minLength;
        private Integer maxLength;
        private String pattern;
        private List<String> values;
        private Object defaultValue;
        private boolean trim;
        private boolean lowercase;
        private boolean positive;
        private final Map<ViolationKind, String> messages = new EnumMap<>(ViolationKind.class);

        private Builder(SemanticType type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder required(boolean v) { this.required = v; return this; }
        public Builder min(BigDecimal v) { this.min = v; return this; }
        public Builder min(long v) { this.min = BigDecimal.valueOf(v); return this; }
        public Builder max(BigDecimal v) { this.max = v; return this; }
        public Builder max(long v) { this.max = BigDecimal.valueOf(v); return this; }
        public Builder minLength(Integer v) { this.minLength = v; return this; }
        public Builder maxLength(Integer v) { this.maxLength = v; return this; }
        public Builder pattern(String v) { this.pattern = v; return this; }
        public Builder values(List<String> v) { this.values = v; return this; }
        public Builder values(String... v) { this.values = List.of(v); return this; }
        public Builder defaultValue(Object v) { this.defaultValue = v; return this; }
        public Builder trim(boolean v) { this.trim = v; return this; }
        public Builder lowercase(boolean v) { this.lowercase = v; return this; }
        public Builder positive(boolean v) { this.positive = v; return this; }
        public Builder message(ViolationKind kind, String text) { this.messages.put(kind, text); return this; }

        public FieldDef build() {
            return new FieldDef(type, required, min, max, minLength, maxLength, pattern, values,
                    defaultValue, trim, lowercase, positive, messages);
        }
    }
}
