package com.fieldops.application.ports;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * What an audit subsystem needs to record one change. Values maps may be null (e.g. no old value on create).
 */
public record AuditEvent(
        String action,
        String resourceType,
        String resourceId,
        Map<String, Object> oldValues,
        Map<String, Object> newValues,
        String actorRole,
        String actorId,
        String requestId,
        Instant at
) {
    public AuditEvent {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(at, "at");
    }
}
