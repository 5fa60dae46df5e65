package com.fieldops.application.service;

import com.fieldops.application.CoreFixture;
import com.fieldops.application.ports.AuditEvent;
import com.fieldops.application.ports.impl.StaticRoleSource;
import com.fieldops.application.role.RoleHierarchyResolver;
import com.fieldops.domain.role.RoleHierarchy;
import com.fieldops.domain.role.RoleRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RoleAdminServiceTest {

    @Test
    void reloadSwapsHierarchyAndAudits() {
        List<RoleRecord> roles = new ArrayList<>(StaticRoleSource.DEFAULT_ROLES);
        RoleHierarchyResolver resolver = new RoleHierarchyResolver(() -> List.copyOf(roles));
        List<AuditEvent> events = new ArrayList<>();
        RoleAdminService admin = new RoleAdminService(resolver, new AuditEmitter(events::add, null, CoreFixture.CLOCK));

        assertThat(admin.current().names()).hasSize(5);
        roles.add(RoleRecord.of("owner", 10));

        RoleHierarchy after = admin.reload(CallerContext.of("admin", "root", "req-9"));

        assertThat(after.names()).endsWith("owner");
        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.action()).isEqualTo("role_hierarchy_reload");
            assertThat(e.actorRole()).isEqualTo("admin");
            assertThat(e.newValues()).containsEntry("roles", after.names());
            assertThat(e.at()).isEqualTo(CoreFixture.CLOCK.instant());
        });
    }
}
