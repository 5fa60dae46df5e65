package com.fieldops.api.security;

import com.fieldops.api.tracing.RequestContext;
import com.fieldops.application.service.CallerContext;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

/**
 * Provides a stable way for service-layer code to understand who is acting.
 *
 * - role = JWT claim "role", a role name or a legacy numeric priority, passed through unresolved
 * - actorId = JWT subject
 * - requestId = current correlation id
 *
 * HTTP callers are never system callers: a token without a role claim acts as the lowest role.
 */
public final class SecurityActor {

  static final String NO_ROLE = "";

  private SecurityActor() {}

  public static CallerContext current() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (!(auth instanceof JwtAuthenticationToken jat)) {
      return CallerContext.of(NO_ROLE, null, RequestContext.requestId());
    }
    Jwt jwt = jat.getToken();
    Object role = jwt.getClaim("role");
    return CallerContext.of(role == null ? NO_ROLE : role, jwt.getSubject(), RequestContext.requestId());
  }
}
