package com.fieldops.application.service;

import com.fieldops.application.role.RoleHierarchyResolver;
import com.fieldops.domain.role.RoleHierarchy;

import java.util.Map;
import java.util.Objects;

/**
 * Administrative view of the role hierarchy. Reloading also clears every role-keyed cache
 * (the resolver notifies its listeners) and is audited.
 */
public class RoleAdminService {

    private final RoleHierarchyResolver roles;
    private final AuditEmitter audit;

    public RoleAdminService(RoleHierarchyResolver roles, AuditEmitter audit) {
        this.roles = Objects.requireNonNull(roles, "roles");
        this.audit = Objects.requireNonNull(audit, "audit");
    }

    public RoleHierarchy current() {
        return roles.hierarchy();
    }

    public RoleHierarchy reload(CallerContext caller) {
        RoleHierarchy before = roles.hierarchy();
        RoleHierarchy after = roles.reload();
        audit.emit("role_hierarchy_reload", "roles", null,
                Map.of("roles", before.names()),
                Map.of("roles", after.names()),
                caller.isSystem() ? "system" : roles.normalizeRoleName(caller.role()),
                caller);
        return after;
    }
}
