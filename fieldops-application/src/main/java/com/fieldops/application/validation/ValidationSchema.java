package com.fieldops.application.validation;

import com.fieldops.domain.error.FieldViolation;
import com.fieldops.domain.error.ValidationFailedException;
import com.fieldops.domain.metadata.Operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Built rule set for one (entity, operation, role). Immutable; shared across requests.
 */
public final class ValidationSchema {

    private final String entityName;
    private final Operation operation;
    private final String role;
    private final Map<String, SchemaField> fields;

    ValidationSchema(String entityName, Operation operation, String role, Map<String, SchemaField> fields) {
        this.entityName = Objects.requireNonNull(entityName, "entityName");
        this.operation = Objects.requireNonNull(operation, "operation");
        this.role = role;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String entityName() {
        return entityName;
    }

    public Operation operation() {
        return operation;
    }

    /** Normalized role, or null for the unrestricted schema. */
    public String role() {
        return role;
    }

    public Map<String, SchemaField> fields() {
        return fields;
    }

    public Set<String> requiredFields() {
        Set<String> out = new LinkedHashSet<>();
        fields.values().forEach(f -> {
            if (f.required()) out.add(f.name());
        });
        return out;
    }

    /**
     * Checks every known field and collects all violations. Unknown payload fields are dropped from the result.
     * On create, an absent field with a default takes the default.
     */
    public ValidationResult validate(Map<String, Object> payload) {
        Map<String, Object> input = payload == null ? Map.of() : payload;
        Map<String, Object> accepted = new LinkedHashMap<>();
        List<FieldViolation> violations = new ArrayList<>();
        Set<String> stripped = new LinkedHashSet<>();

        for (String key : input.keySet()) {
            if (!fields.containsKey(key)) stripped.add(key);
        }

        for (SchemaField f : fields.values()) {
            boolean present = input.containsKey(f.name());
            Object raw = input.get(f.name());
            if (!present) {
                if (operation == Operation.CREATE && f.def().defaultValue() != null) {
                    raw = f.def().defaultValue();
                } else if (!f.required()) {
                    continue;
                }
            }
            RuleOutcome o = f.rule().check(f.name(), raw);
            if (o.isOk()) {
                accepted.put(f.name(), o.value());
            } else {
                violations.add(new FieldViolation(f.name(), o.kind(), o.message()));
            }
        }
        return new ValidationResult(accepted, violations, stripped);
    }

    /**
     * @throws ValidationFailedException with every violation found
     */
    public Map<String, Object> validateOrThrow(Map<String, Object> payload) {
        ValidationResult r = validate(payload);
        if (!r.isValid()) throw new ValidationFailedException(r.violations());
        return r.value();
    }

    @Override
    public String toString() {
        return "ValidationSchema[" + entityName + ":" + operation.key() + ":" + (role == null ? "*" : role)
                + " fields=" + fields.keySet() + "]";
    }
}
