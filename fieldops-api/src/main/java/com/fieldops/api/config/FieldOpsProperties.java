package com.fieldops.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Engine settings under {@code fieldops.*}.
 */
@ConfigurationProperties(prefix = "fieldops")
public record FieldOpsProperties(

    @DefaultValue Identifiers identifiers,

    @DefaultValue Metadata metadata,

    @DefaultValue Roles roles,

    @DefaultValue Auth auth,

    @DefaultValue Read read

) {

  /**
   * @param maxAttempts regenerate-and-retry bound when a minted identifier collides
   */
  public record Identifiers(@DefaultValue("5") int maxAttempts) {}

  public record Metadata(@DefaultValue("classpath*:metadata/*.json") String location) {}

  /**
   * @param source {@code database} (the roles table) or {@code static} (built-in five-role ladder)
   */
  public record Roles(@DefaultValue("database") String source) {

    public boolean isStatic() {
      return "static".equalsIgnoreCase(source == null ? "" : source.trim());
    }
  }

  public record Auth(String jwtSecret) {}

  public record Read(@DefaultValue("200") int maxPageSize) {}
}
