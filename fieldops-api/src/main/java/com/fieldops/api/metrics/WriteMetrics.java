package com.fieldops.api.metrics;

import com.fieldops.application.ports.EntityWriteObserver;
import com.fieldops.domain.ErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Write-path counters.
 *
 * Exposes:
 * - fieldops.identifiers.collisions
 * - fieldops.writes.constraint_violations (tag: category)
 * - fieldops.audit.failures
 * - fieldops.writes.completed (tags: entity, operation)
 */
public class WriteMetrics implements EntityWriteObserver {

  private final MeterRegistry registry;
  private final Counter collisions;
  private final Counter auditFailures;

  public WriteMetrics(MeterRegistry registry) {
    this.registry = registry;
    this.collisions = Counter.builder("fieldops.identifiers.collisions")
        .description("Minted identifiers rejected by the unique constraint")
        .register(registry);
    this.auditFailures = Counter.builder("fieldops.audit.failures")
        .description("Audit rows that could not be written")
        .register(registry);
  }

  @Override
  public void onIdentifierCollision(String entityName, String identifier, int attempt) {
    collisions.increment();
  }

  @Override
  public void onConstraintTranslated(String entityName, ErrorCategory category) {
    Counter.builder("fieldops.writes.constraint_violations")
        .description("Storage constraint violations turned into domain errors")
        .tag("category", category.code())
        .register(registry)
        .increment();
  }

  @Override
  public void onWriteCompleted(String entityName, String operation) {
    Counter.builder("fieldops.writes.completed")
        .tag("entity", entityName)
        .tag("operation", operation)
        .register(registry)
        .increment();
  }

  @Override
  public void onAuditFailure(String action, Exception error) {
    auditFailures.increment();
  }
}
