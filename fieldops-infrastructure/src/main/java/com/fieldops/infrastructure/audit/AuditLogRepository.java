package com.fieldops.infrastructure.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AuditLogRepository extends JpaRepository<AuditLogEntity, UUID> {

  List<AuditLogEntity> findByResourceTypeAndResourceIdOrderByCreatedAtAsc(String resourceType, String resourceId);

  List<AuditLogEntity> findByActionOrderByCreatedAtAsc(String action);
}
