package com.fieldops.infrastructure.db;

import com.fieldops.application.ports.RoleSource;
import com.fieldops.domain.role.RoleRecord;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * Active roles from the {@code roles} table, lowest priority first.
 */
public final class JdbcRoleSource implements RoleSource {

  private final JdbcTemplate jdbc;

  public JdbcRoleSource(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public List<RoleRecord> loadRoles() {
    return jdbc.query(
        "SELECT name, priority FROM roles WHERE is_active = true ORDER BY priority",
        (rs, rowNum) -> new RoleRecord(rs.getString("name"), rs.getInt("priority")));
  }
}
