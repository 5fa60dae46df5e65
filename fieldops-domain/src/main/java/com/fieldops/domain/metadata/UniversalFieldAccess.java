package com.fieldops.domain.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Baseline access rules for columns every entity shares. Entity metadata may override any entry.
 */
public final class UniversalFieldAccess {

    private static final Map<String, CrudAccess> BASELINE;

    static {
        Map<String, CrudAccess> m = new LinkedHashMap<>();
        m.put("id", CrudAccess.readOnly("customer"));
        m.put("is_active", CrudAccess.of("manager", "customer", "manager", CrudAccess.NONE));
        m.put("status", CrudAccess.of("dispatcher", "customer", "dispatcher", CrudAccess.NONE));
        m.put("created_at", CrudAccess.readOnly("customer"));
        m.put("updated_at", CrudAccess.readOnly("customer"));
        BASELINE = Collections.unmodifiableMap(m);
    }

    private UniversalFieldAccess() {
    }

    public static Map<String, CrudAccess> baseline() {
        return BASELINE;
    }

    /** Baseline entries first, then entity entries replacing them field by field. */
    public static Map<String, CrudAccess> merge(Map<String, CrudAccess> entityAccess) {
        Map<String, CrudAccess> merged = new LinkedHashMap<>(BASELINE);
        if (entityAccess != null) merged.putAll(entityAccess);
        return Collections.unmodifiableMap(merged);
    }
}
