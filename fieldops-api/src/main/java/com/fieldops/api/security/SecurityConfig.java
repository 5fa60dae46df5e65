package com.fieldops.api.security;

import com.fieldops.application.role.RoleHierarchyResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Security configuration for the FieldOps API.
 *
 * - Stateless (JWT only, no sessions)
 * - Fail-closed: everything outside the listed paths is denied
 * - Coarse checks only; per-entity and per-field rules live in the core
 */
@Configuration
public class SecurityConfig {

  @Bean
  @Order(2)
  SecurityFilterChain publicChain(HttpSecurity http) throws Exception {
    return http
        .securityMatcher("/error")
        .csrf(csrf -> csrf.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
        .build();
  }

  @Bean
  @Order(3)
  SecurityFilterChain securedApiChain(HttpSecurity http, RoleHierarchyResolver roles) throws Exception {
    return http
        .securityMatcher("/api/**")
        .csrf(csrf -> csrf.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
            .requestMatchers("/api/v1/admin/**").hasRole("ADMIN")
            .requestMatchers("/api/v1/**").authenticated()
            .anyRequest().denyAll()
        )
        .oauth2ResourceServer(oauth -> oauth
            .jwt(jwt -> jwt.jwtAuthenticationConverter(new JwtRoleConverter(roles)))
        )
        .build();
  }

  @Bean
  @Order(4)
  SecurityFilterChain fallbackChain(HttpSecurity http) throws Exception {
    return http
        .csrf(csrf -> csrf.disable())
        .authorizeHttpRequests(auth -> auth.anyRequest().denyAll())
        .build();
  }
}
