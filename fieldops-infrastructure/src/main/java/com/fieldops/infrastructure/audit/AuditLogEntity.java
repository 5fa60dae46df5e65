package com.fieldops.infrastructure.audit;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "audit_log",
    indexes = {
        @Index(name = "ix_audit_log_created_at", columnList = "created_at"),
        @Index(name = "ix_audit_log_resource", columnList = "resource_type,resource_id")
    }
)
public class AuditLogEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "action", nullable = false, length = 128)
  private String action;

  @Column(name = "resource_type", nullable = false, length = 64)
  private String resourceType;

  @Column(name = "resource_id", length = 128)
  private String resourceId;

  // JSON kept as TEXT so PostgreSQL and H2 share one mapping
  @Column(name = "old_values", columnDefinition = "TEXT")
  private String oldValues;

  @Column(name = "new_values", columnDefinition = "TEXT")
  private String newValues;

  @Column(name = "actor_role", length = 50)
  private String actorRole;

  @Column(name = "actor_id", length = 128)
  private String actorId;

  @Column(name = "request_id", length = 128)
  private String requestId;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected AuditLogEntity() {}

  public AuditLogEntity(UUID id, String action, String resourceType, String resourceId,
                        String oldValues, String newValues, String actorRole, String actorId,
                        String requestId, Instant createdAt) {
    this.id = id;
    this.action = action;
    this.resourceType = resourceType;
    this.resourceId = resourceId;
    this.oldValues = oldValues;
    this.newValues = newValues;
    this.actorRole = actorRole;
    this.actorId = actorId;
    this.requestId = requestId;
    this.createdAt = createdAt;
  }

  public UUID getId() { return id; }
  public String getAction() { return action; }
  public String getResourceType() { return resourceType; }
  public String getResourceId() { return resourceId; }
  public String getOldValues() { return oldValues; }
  public String getNewValues() { return newValues; }
  public String getActorRole() { return actorRole; }
  public String getActorId() { return actorId; }
  public String getRequestId() { return requestId; }
  public Instant getCreatedAt() { return createdAt; }
}
