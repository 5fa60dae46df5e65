package com.fieldops.application.validation;

import com.fieldops.application.access.FieldAccessController;
import com.fieldops.application.role.RoleHierarchyResolver;
import com.fieldops.domain.metadata.EntityMetadata;
import com.fieldops.domain.metadata.FieldDef;
import com.fieldops.domain.metadata.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds and caches role-aware write schemas.
 *
 * <ul>
 *   <li>create: every field the role may create; required = metadata required fields the role may create.</li>
 *   <li>update: every non-immutable field the role may update; all optional.</li>
 * </ul>
 * Without a role the schema is unrestricted (system callers) and cached under its own key.
 */
public class ValidationSchemaBuilder {

    private static final Logger log = LoggerFactory.getLogger(ValidationSchemaBuilder.class);

    private final FieldRuleFactory rules;
    private final FieldAccessController access;
    private final RoleHierarchyResolver roles;
    private final Map<String, ValidationSchema> cache = new ConcurrentHashMap<>();

    public ValidationSchemaBuilder(FieldRuleFactory rules, FieldAccessController access, RoleHierarchyResolver roles) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.access = Objects.requireNonNull(access, "access");
        this.roles = Objects.requireNonNull(roles, "roles");
        roles.addReloadListener(this::clearCache);
    }

    public ValidationSchema buildEntitySchema(EntityMetadata metadata, Operation operation, Object role) {
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(operation, "operation");
        if (operation != Operation.CREATE && operation != Operation.UPDATE) {
            throw new IllegalArgumentException("Schemas exist for create and update only, got " + operation);
        }
        String roleName = role == null ? null : roles.normalizeRoleName(role);
        String key = cacheKey(metadata.entityName(), operation, roleName);
        return cache.computeIfAbsent(key, k -> {
            ValidationSchema s = compose(metadata, operation, roleName);
            log.debug("[SCHEMA] built key={} fields={} required={}", k, s.fields().keySet(), s.requiredFields());
            return s;
        });
    }

    public void clearCache() {
        cache.clear();
    }

    public Set<String> cachedKeys() {
        return Set.copyOf(cache.keySet());
    }

    static String cacheKey(String entity, Operation operation, String roleName) {
        return roleName == null ? entity + ":" + operation.key() : entity + ":" + operation.key() + ":" + roleName;
    }

    private ValidationSchema compose(EntityMetadata metadata, Operation operation, String roleName) {
        Set<String> permitted = roleName == null ? null : access.fieldsForOperation(metadata, roleName, operation);
        Map<String, SchemaField> fields = new LinkedHashMap<>();
        for (Map.Entry<String, FieldDef> e : metadata.fields().entrySet()) {
            String name = e.getKey();
            if (permitted != null && !permitted.contains(name)) continue;
            if (operation == Operation.UPDATE && metadata.isImmutable(name)) continue;

            boolean required = operation == Operation.CREATE && metadata.isRequired(name);
            fields.put(name, new SchemaField(name, e.getValue(), required, rules.build(e.getValue(), required)));
        }
        return new ValidationSchema(metadata.entityName(), operation, roleName, fields);
    }
}
