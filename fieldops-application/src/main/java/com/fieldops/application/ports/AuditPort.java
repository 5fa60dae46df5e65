package com.fieldops.application.ports;

/**
 * Audit sink. Failures surface as runtime exceptions; callers log and count them
 * but never undo the change being audited.
 */
public interface AuditPort {
    void record(AuditEvent event);
}
