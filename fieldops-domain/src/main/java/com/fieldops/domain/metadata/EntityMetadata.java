package com.fieldops.domain.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Frozen definition of one entity type.
 *
 * <p>{@code fieldAccess} holds only what the entity declares; {@link #effectiveFieldAccess()} is the view with the
 * universal baseline merged underneath. A field missing from the effective map is denied for every role.
 *
 * <p>{@code requiredFields} also picks up every field whose definition is flagged required.
 *
 * <p>{@code identityField} and {@code identifierPrefix} are both set for entities whose human-facing key is minted
 * by the service (e.g. {@code WO-2026-0001}); for other entities the prefix is null.
 *
 * <p>{@code searchableFields}, {@code filterableFields} and {@code sortableFields} whitelist the columns a list
 * read may search, filter or order by. Without a declared {@code defaultSort} lists are ordered by primary key.
 */
public record EntityMetadata(
        String entityName,
        String tableName,
        String primaryKey,
        String identityField,
        String identifierPrefix,
        Map<String, FieldDef> fields,
        Map<String, CrudAccess> fieldAccess,
        List<String> requiredFields,
        Set<String> immutableFields,
        Map<String, ForeignKeyRef> foreignKeys,
        CrudAccess entityPermissions,
        List<String> searchableFields,
        List<String> filterableFields,
        List<String> sortableFields,
        DefaultSort defaultSort
) {
    /** Columns every table carries whether or not the metadata declares them. */
    public static final Set<String> TIMESTAMP_COLUMNS = Set.of("created_at", "updated_at");

    public EntityMetadata {
        Objects.requireNonNull(entityName, "entityName");
        Objects.requireNonNull(tableName, "tableName");
        if (entityName.isBlank()) throw new IllegalArgumentException("entityName is blank");
        if (tableName.isBlank()) throw new IllegalArgumentException("tableName is blank");
        if (primaryKey == null || primaryKey.isBlank()) primaryKey = "id";
        if (identifierPrefix != null && identifierPrefix.isBlank()) identifierPrefix = null;
        fields = frozen(fields);
        fieldAccess = frozen(fieldAccess);
        // a field flagged required in its definition counts as listed
        Set<String> required = new LinkedHashSet<>(requiredFields == null ? List.of() : requiredFields);
        fields.forEach((name, def) -> {
            if (def.required()) required.add(name);
        });
        requiredFields = List.copyOf(required);
        immutableFields = immutableFields == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(immutableFields));
        foreignKeys = frozen(foreignKeys);
        if (entityPermissions == null) entityPermissions = CrudAccess.DENY_ALL;
        searchableFields = distinct(searchableFields);
        filterableFields = distinct(filterableFields);
        sortableFields = distinct(sortableFields);
        if (defaultSort == null) defaultSort = new DefaultSort(primaryKey, SortDirection.ASC);
    }

    public static Builder builder(String entityName, String tableName) {
        return new Builder(entityName, tableName);
    }

    public Map<String, CrudAccess> effectiveFieldAccess() {
        return UniversalFieldAccess.merge(fieldAccess);
    }

    public boolean mintsIdentifier() {
        return identifierPrefix != null && identityField != null;
    }

    public boolean isRequired(String field) {
        return requiredFields.contains(field);
    }

    public boolean isImmutable(String field) {
        return immutableFields.contains(field);
    }

    public FieldDef field(String name) {
        return fields.get(name);
    }

    /** True for declared fields, the primary key and the shared timestamp columns. */
    public boolean hasColumn(String name) {
        return fields.containsKey(name) || primaryKey.equals(name) || TIMESTAMP_COLUMNS.contains(name);
    }

    public String displayName() {
        return FieldLabels.humanize(entityName);
    }

    private static <V> Map<String, V> frozen(Map<String, V> m) {
        if (m == null || m.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }

    private static List<String> distinct(List<String> names) {
        if (names == null || names.isEmpty()) return List.of();
        return List.copyOf(new LinkedHashSet<>(names));
    }

    public static final class Builder {
        private final String entityName;
        private final String tableName;
        private String primaryKey = "id";
        private String identityField;
        private String identifierPrefix;
        private final Map<String, FieldDef> fields = new LinkedHashMap<>();
        private final Map<String, CrudAccess> fieldAccess = new LinkedHashMap<>();
        private final List<String> requiredFields = new ArrayList<>();
        private final Set<String> immutableFields = new LinkedHashSet<>();
        private final Map<String, ForeignKeyRef> foreignKeys = new LinkedHashMap<>();
        private CrudAccess entityPermissions;
        private final List<String> searchableFields = new ArrayList<>();
        private final List<String> filterableFields = new ArrayList<>();
        private final List<String> sortableFields = new ArrayList<>();
        private DefaultSort defaultSort;

        private Builder(String entityName, String tableName) {
            this.entityName = entityName;
            this.tableName = tableName;
        }

        public Builder primaryKey(String v) { this.primaryKey = v; return this; }
        public Builder identityField(String v) { this.identityField = v; return this; }
        public Builder identifierPrefix(String v) { this.identifierPrefix = v; return this; }
        public Builder field(String name, FieldDef def) { this.fields.put(name, def); return this; }
        public Builder access(String name, CrudAccess access) { this.fieldAccess.put(name, access); return this; }
        public Builder required(String... names) { this.requiredFields.addAll(List.of(names)); return this; }
        public Builder immutable(String... names) { this.immutableFields.addAll(List.of(names)); return this; }
        public Builder foreignKey(String field, ForeignKeyRef ref) { this.foreignKeys.put(field, ref); return this; }
        public Builder entityPermissions(CrudAccess v) { this.entityPermissions = v; return this; }
        public Builder searchable(String... names) { this.searchableFields.addAll(List.of(names)); return this; }
        public Builder filterable(String... names) { this.filterableFields.addAll(List.of(names)); return this; }
        public Builder sortable(String... names) { this.sortableFields.addAll(List.of(names)); return this; }
        public Builder defaultSort(String field, SortDirection direction) {
            this.defaultSort = new DefaultSort(field, direction);
            return this;
        }

        public EntityMetadata build() {
            return new EntityMetadata(entityName, tableName, primaryKey, identityField, identifierPrefix,
                    fields, fieldAccess, requiredFields, immutableFields, foreignKeys, entityPermissions,
                    searchableFields, filterableFields, sortableFields, defaultSort);
        }
    }
}
