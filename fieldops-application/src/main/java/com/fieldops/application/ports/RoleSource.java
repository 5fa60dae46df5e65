package com.fieldops.application.ports;

import com.fieldops.domain.role.RoleRecord;

import java.util.List;

/**
 * Where the role hierarchy comes from (database table, static config).
 * Implementations return active roles ordered by priority, lowest first.
 */
public interface RoleSource {
    List<RoleRecord> loadRoles();
}
