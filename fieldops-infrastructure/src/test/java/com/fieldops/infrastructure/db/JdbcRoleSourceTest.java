package com.fieldops.infrastructure.db;

import com.fieldops.domain.role.RoleRecord;
import com.fieldops.infrastructure.H2Fixture;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcRoleSourceTest {

  @Test
  void loadsSeededActiveRolesInPriorityOrder() {
    H2Fixture db = new H2Fixture();
    db.jdbc.update("UPDATE roles SET is_active = false WHERE name = 'technician'", Map.of());

    JdbcRoleSource source = new JdbcRoleSource(new JdbcTemplate(db.dataSource));

    assertThat(source.loadRoles()).extracting(RoleRecord::name)
        .containsExactly("customer", "dispatcher", "manager", "admin");
    assertThat(source.loadRoles().get(0).priority()).isEqualTo(1);
  }
}
