package com.fieldops.api.web;

import com.fieldops.api.security.SecurityActor;
import com.fieldops.application.service.RoleAdminService;
import com.fieldops.domain.role.RoleHierarchy;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/roles")
public class AdminRoleController {

  private final RoleAdminService roles;

  public AdminRoleController(RoleAdminService roles) {
    this.roles = roles;
  }

  public record RoleRow(String name, int priority) {}

  @GetMapping
  public List<RoleRow> current() {
    return rows(roles.current());
  }

  /** Re-reads the hierarchy and drops every role-keyed cache. */
  @PostMapping("/reload")
  public List<RoleRow> reload() {
    return rows(roles.reload(SecurityActor.current()));
  }

  private static List<RoleRow> rows(RoleHierarchy h) {
    return h.roles().stream().map(r -> new RoleRow(r.name(), r.priority())).toList();
  }
}
