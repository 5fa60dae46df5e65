package com.fieldops.application.metadata;

import com.fieldops.domain.error.ConfigurationException;
import com.fieldops.domain.metadata.EntityMetadata;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Frozen set of entity definitions, keyed by entity name. Built once at startup.
 */
public final class MetadataRegistry {

    private final Map<String, EntityMetadata> byName;

    private MetadataRegistry(Map<String, EntityMetadata> byName) {
        this.byName = Collections.unmodifiableMap(byName);
    }

    /**
     * @throws ConfigurationException on duplicate entity or table names
     */
    public static MetadataRegistry of(List<EntityMetadata> entities) {
        Map<String, EntityMetadata> m = new LinkedHashMap<>();
        Map<String, String> tables = new LinkedHashMap<>();
        for (EntityMetadata e : entities) {
            String key = e.entityName().toLowerCase(Locale.ROOT);
            if (m.putIfAbsent(key, e) != null) {
                throw new ConfigurationException("Duplicate entity metadata: " + e.entityName());
            }
            String owner = tables.putIfAbsent(e.tableName(), e.entityName());
            if (owner != null) {
                throw new ConfigurationException(
                        "Table '" + e.tableName() + "' is used by both " + owner + " and " + e.entityName());
            }
        }
        return new MetadataRegistry(m);
    }

    public Optional<EntityMetadata> find(String entityName) {
        if (entityName == null) return Optional.empty();
        return Optional.ofNullable(byName.get(entityName.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * @throws ConfigurationException when the entity is not registered
     */
    public EntityMetadata require(String entityName) {
        return find(entityName).orElseThrow(() -> new ConfigurationException("Unknown entity: " + entityName));
    }

    public Collection<EntityMetadata> all() {
        return byName.values();
    }

    public Set<String> entityNames() {
        return byName.keySet();
    }

    public Set<String> tableNames() {
        return Set.copyOf(byName.values().stream().map(EntityMetadata::tableName).toList());
    }
}
