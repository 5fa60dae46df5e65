package com.fieldops.application.ports;

import com.fieldops.domain.ErrorCategory;

/**
 * Optional observer for write telemetry. Keeps metrics out of the write path.
 */
public interface EntityWriteObserver {
    default void onIdentifierCollision(String entityName, String identifier, int attempt) {}
    default void onConstraintTranslated(String entityName, ErrorCategory category) {}
    default void onWriteCompleted(String entityName, String operation) {}
    default void onAuditFailure(String action, Exception error) {}
}
