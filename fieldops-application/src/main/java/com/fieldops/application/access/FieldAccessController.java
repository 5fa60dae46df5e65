package com.fieldops.application.access;

import com.fieldops.application.role.RoleHierarchyResolver;
import com.fieldops.domain.error.PermissionDeniedException;
import com.fieldops.domain.metadata.CrudAccess;
import com.fieldops.domain.metadata.EntityMetadata;
import com.fieldops.domain.metadata.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Field-level access decisions derived from entity metadata and the role hierarchy.
 *
 * <p>A field is accessible for an operation only when its effective access entry names a role the caller meets.
 * Fields without an entry are denied. Computed field sets are cached per (entity, role, operation); concurrent
 * population is harmless because the result for a key is deterministic.
 */
public class FieldAccessController {

    private static final Logger log = LoggerFactory.getLogger(FieldAccessController.class);

    private final RoleHierarchyResolver roles;
    private final Map<AccessKey, Set<String>> cache = new ConcurrentHashMap<>();

    public FieldAccessController(RoleHierarchyResolver roles) {
        this.roles = Objects.requireNonNull(roles, "roles");
        roles.addReloadListener(this::clearCache);
    }

    public Set<String> fieldsForOperation(EntityMetadata metadata, Object role, Operation operation) {
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(operation, "operation");
        String roleName = roles.normalizeRoleName(role);
        return cache.computeIfAbsent(new AccessKey(metadata.entityName(), roleName, operation),
                k -> compute(metadata, roleName, operation));
    }

    public boolean canAccess(EntityMetadata metadata, Object role, Operation operation, String field) {
        return fieldsForOperation(metadata, role, operation).contains(field);
    }

    /** Projects one record to the readable fields. */
    public Map<String, Object> filterDataByRole(Map<String, Object> record, EntityMetadata metadata, Object role) {
        return filterDataByRole(record, metadata, role, Operation.READ);
    }

    public Map<String, Object> filterDataByRole(Map<String, Object> record, EntityMetadata metadata, Object role,
                                                Operation operation) {
        if (record == null) return null;
        return project(record, fieldsForOperation(metadata, role, operation));
    }

    /** Projects every record of a list; the result is a list of the same size and order. */
    public List<Map<String, Object>> filterDataByRole(List<Map<String, Object>> records, EntityMetadata metadata,
                                                      Object role) {
        return filterDataByRole(records, metadata, role, Operation.READ);
    }

    public List<Map<String, Object>> filterDataByRole(List<Map<String, Object>> records, EntityMetadata metadata,
                                                      Object role, Operation operation) {
        if (records == null) return null;
        Set<String> allowed = fieldsForOperation(metadata, role, operation);
        List<Map<String, Object>> out = new ArrayList<>(records.size());
        for (Map<String, Object> r : records) {
            out.add(r == null ? null : project(r, allowed));
        }
        return out;
    }

    /**
     * Fails with every payload field the role may not touch for this operation.
     *
     * @throws PermissionDeniedException listing all denied fields
     */
    public void validateFieldAccess(Map<String, Object> payload, EntityMetadata metadata, Object role,
                                    Operation operation) {
        if (payload == null || payload.isEmpty()) return;
        Set<String> allowed = fieldsForOperation(metadata, role, operation);
        List<String> denied = new ArrayList<>();
        for (String field : payload.keySet()) {
            if (!allowed.contains(field)) denied.add(field);
        }
        if (!denied.isEmpty()) {
            String roleName = roles.normalizeRoleName(role);
            log.debug("[ACCESS] denied entity={} role={} op={} fields={}",
                    metadata.entityName(), roleName, operation.key(), denied);
            throw new PermissionDeniedException(roleName, operation.key(), denied);
        }
    }

    /** Drops fields the role may not write; never fails. */
    public Map<String, Object> filterWritableFields(Map<String, Object> payload, EntityMetadata metadata, Object role,
                                                    Operation operation) {
        if (payload == null) return Map.of();
        return project(payload, fieldsForOperation(metadata, role, operation));
    }

    /**
     * Entity-level gate, checked before any field rule.
     *
     * @throws PermissionDeniedException when the entity permission for this operation is not met
     */
    public void requireEntityPermission(EntityMetadata metadata, Object role, Operation operation) {
        String required = metadata.entityPermissions().requirementFor(operation);
        if (!roles.hasPermission(role, required)) {
            String roleName = roles.normalizeRoleName(role);
            log.debug("[ACCESS] entity denied entity={} role={} op={} required={}",
                    metadata.entityName(), roleName, operation.key(), required);
            throw PermissionDeniedException.forEntity(roleName, operation.key(), metadata.entityName());
        }
    }

    public void clearCache() {
        cache.clear();
    }

    private Set<String> compute(EntityMetadata metadata, String roleName, Operation operation) {
        Set<String> out = new LinkedHashSet<>();
        for (Map.Entry<String, CrudAccess> e : metadata.effectiveFieldAccess().entrySet()) {
            if (roles.hasPermission(roleName, e.getValue().requirementFor(operation))) {
                out.add(e.getKey());
            }
        }
        return Collections.unmodifiableSet(out);
    }

    private static Map<String, Object> project(Map<String, Object> source, Set<String> allowed) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : source.entrySet()) {
            if (allowed.contains(e.getKey())) out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    private record AccessKey(String entity, String role, Operation operation) {
    }
}
