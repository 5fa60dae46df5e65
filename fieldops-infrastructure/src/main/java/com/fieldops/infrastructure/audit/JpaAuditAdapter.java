package com.fieldops.infrastructure.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.application.ports.AuditEvent;
import com.fieldops.application.ports.AuditPort;

import java.util.Map;
import java.util.UUID;

/**
 * Persists audit events into {@code audit_log}. Failures propagate to the caller.
 */
public final class JpaAuditAdapter implements AuditPort {

  private final AuditLogRepository repository;
  private final ObjectMapper json;

  public JpaAuditAdapter(AuditLogRepository repository, ObjectMapper json) {
    this.repository = repository;
    this.json = json;
  }

  @Override
  public void record(AuditEvent event) {
    repository.save(new AuditLogEntity(
        UUID.randomUUID(),
        event.action(),
        event.resourceType(),
        event.resourceId(),
        toJson(event.oldValues()),
        toJson(event.newValues()),
        event.actorRole(),
        event.actorId(),
        event.requestId(),
        event.at()));
  }

  private String toJson(Map<String, Object> values) {
    if (values == null) return null;
    try {
      return json.writeValueAsString(values);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize audit values", e);
    }
  }
}
