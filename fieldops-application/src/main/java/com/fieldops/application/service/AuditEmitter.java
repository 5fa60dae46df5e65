package com.fieldops.application.service;

import com.fieldops.application.ports.AuditEvent;
import com.fieldops.application.ports.AuditPort;
import com.fieldops.application.ports.EntityWriteObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Builds {@link AuditEvent}s and hands them to the {@link AuditPort}. A failing sink is logged and counted;
 * the change being audited is already committed and stays so.
 */
public class AuditEmitter {

    private static final Logger log = LoggerFactory.getLogger(AuditEmitter.class);

    private final AuditPort audit;
    private final EntityWriteObserver observer;
    private final Clock clock;

    public AuditEmitter(AuditPort audit, EntityWriteObserver observer, Clock clock) {
        this.audit = Objects.requireNonNull(audit, "audit");
        this.observer = observer == null ? new EntityWriteObserver() {} : observer;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void emit(String action, String resourceType, Object resourceId,
                     Map<String, Object> oldValues, Map<String, Object> newValues,
                     String actorRole, CallerContext caller) {
        AuditEvent event = new AuditEvent(
                action,
                resourceType,
                resourceId == null ? null : String.valueOf(resourceId),
                oldValues,
                newValues,
                actorRole,
                caller.actorId(),
                caller.requestId(),
                clock.instant());
        try {
            audit.record(event);
        } catch (RuntimeException e) {
            log.error("[AUDIT] write failed action={} resourceType={} resourceId={} requestId={}",
                    action, resourceType, event.resourceId(), caller.requestId(), e);
            observer.onAuditFailure(action, e);
        }
    }
}
