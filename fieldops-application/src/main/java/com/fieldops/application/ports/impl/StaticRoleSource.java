package com.fieldops.application.ports.impl;

import com.fieldops.application.ports.RoleSource;
import com.fieldops.domain.role.RoleRecord;

import java.util.Comparator;
import java.util.List;

/**
 * Fixed role list, for tests and deployments without a roles table.
 */
public final class StaticRoleSource implements RoleSource {

    public static final List<RoleRecord> DEFAULT_ROLES = List.of(
            RoleRecord.of("customer", 1),
            RoleRecord.of("technician", 2),
            RoleRecord.of("dispatcher", 3),
            RoleRecord.of("manager", 4),
            RoleRecord.of("admin", 5));

    private final List<RoleRecord> roles;

    public StaticRoleSource() {
        this(DEFAULT_ROLES);
    }

    public StaticRoleSource(List<RoleRecord> roles) {
        this.roles = roles.stream().sorted(Comparator.comparingInt(RoleRecord::priority)).toList();
    }

    @Override
    public List<RoleRecord> loadRoles() {
        return roles;
    }
}
