package com.fieldops.api.metrics;

import com.fieldops.domain.ErrorCategory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WriteMetricsTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final WriteMetrics metrics = new WriteMetrics(registry);

  @Test
  void constraintViolationsAreTaggedByCategory() {
    metrics.onConstraintTranslated("customer", ErrorCategory.CONFLICT_ERROR);
    metrics.onConstraintTranslated("work_order", ErrorCategory.CONFLICT_ERROR);
    metrics.onConstraintTranslated("customer", ErrorCategory.DELETE_BLOCKED);

    assertThat(registry.get("fieldops.writes.constraint_violations").tag("category", "ConflictError").counter().count())
        .isEqualTo(2.0);
    assertThat(registry.get("fieldops.writes.constraint_violations").tag("category", "DeleteBlocked").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void collisionsAndAuditFailuresCount() {
    metrics.onIdentifierCollision("work_order", "WO-2026-0007", 1);
    metrics.onAuditFailure("work_order_create", new IllegalStateException("down"));

    assertThat(registry.get("fieldops.identifiers.collisions").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("fieldops.audit.failures").counter().count()).isEqualTo(1.0);
  }

  @Test
  void completedWritesTaggedByEntityAndOperation() {
    metrics.onWriteCompleted("invoice", "create");

    assertThat(registry.get("fieldops.writes.completed")
        .tag("entity", "invoice").tag("operation", "create").counter().count()).isEqualTo(1.0);
  }
}
