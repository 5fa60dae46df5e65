package com.fieldops.application.validation;

import com.fieldops.domain.metadata.FieldDef;

import java.util.Objects;

public record SchemaField(String name, FieldDef def, boolean required, FieldRule rule) {
    public SchemaField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(def, "def");
        Objects.requireNonNull(rule, "rule");
    }
}
