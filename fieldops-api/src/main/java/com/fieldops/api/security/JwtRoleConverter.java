package com.fieldops.api.security;

import com.fieldops.application.role.RoleHierarchyResolver;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.List;
import java.util.Locale;

/**
 * Maps JWT claim "role" (name like "dispatcher", or legacy priority like 3) to a single authority
 * ("ROLE_DISPATCHER"). Unknown or missing roles resolve to the lowest role in the hierarchy.
 */
public final class JwtRoleConverter implements Converter<Jwt, AbstractAuthenticationToken> {

  private final RoleHierarchyResolver roles;

  public JwtRoleConverter(RoleHierarchyResolver roles) {
    this.roles = roles;
  }

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    String role = roles.normalizeRoleName(jwt.getClaim("role"));
    return new JwtAuthenticationToken(jwt,
        List.of(new SimpleGrantedAuthority("ROLE_" + role.toUpperCase(Locale.ROOT))));
  }
}
