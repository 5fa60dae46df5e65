package com.fieldops.application.service;

/**
 * Who is calling.
 *
 * @param role      role name or legacy numeric priority as received; null for internal system callers,
 *                  which bypass field-level checks and get the unrestricted schema
 * @param actorId   subject id for auditing, may be null
 * @param requestId correlation id, may be null
 */
public record CallerContext(Object role, String actorId, String requestId) {

    public static CallerContext system() {
        return new CallerContext(null, "system", null);
    }

    public static CallerContext of(Object role, String actorId, String requestId) {
        return new CallerContext(role, actorId, requestId);
    }

    public boolean isSystem() {
        return role == null;
    }
}
