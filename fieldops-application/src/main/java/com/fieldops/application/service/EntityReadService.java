package com.fieldops.application.service;

import com.fieldops.application.access.FieldAccessController;
import com.fieldops.application.metadata.MetadataRegistry;
import com.fieldops.application.ports.RecordStore;
import com.fieldops.application.query.ListQuery;
import com.fieldops.application.query.ListQueryPlanner;
import com.fieldops.application.query.ListRequest;
import com.fieldops.domain.metadata.EntityMetadata;
import com.fieldops.domain.metadata.Operation;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Reads records and masks every field the caller's role may not read.
 */
public class EntityReadService {

    private final MetadataRegistry registry;
    private final FieldAccessController access;
    private final RecordStore store;
    private final int maxPageSize;

    public EntityReadService(MetadataRegistry registry, FieldAccessController access, RecordStore store,
                             int maxPageSize) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.access = Objects.requireNonNull(access, "access");
        this.store = Objects.requireNonNull(store, "store");
        if (maxPageSize < 1) throw new IllegalArgumentException("maxPageSize must be >= 1");
        this.maxPageSize = maxPageSize;
    }

    public Optional<Map<String, Object>> findById(String entity, Object id, CallerContext caller) {
        EntityMetadata md = metadata(entity, caller);
        return store.findById(md, id)
                .map(r -> caller.isSystem() ? r : access.filterDataByRole(r, md, caller.role()));
    }

    /** Page of records; {@code limit} is clamped to [1, maxPageSize], negative offsets read as 0. */
    public List<Map<String, Object>> list(String entity, int limit, int offset, CallerContext caller) {
        return list(entity, ListRequest.page(limit, offset), caller);
    }

    /**
     * Searched, filtered and sorted page. Only columns the caller can read take part.
     *
     * @throws com.fieldops.domain.error.ValidationFailedException for a filter the caller may not apply
     */
    public List<Map<String, Object>> list(String entity, ListRequest request, CallerContext caller) {
        EntityMetadata md = metadata(entity, caller);
        int l = Math.max(1, Math.min(request.limit(), maxPageSize));
        int o = Math.max(0, request.offset());
        Predicate<String> readable = caller.isSystem()
                ? md::hasColumn
                : access.fieldsForOperation(md, caller.role(), Operation.READ)::contains;
        ListQuery query = ListQueryPlanner.plan(md, readable, request, l, o);
        if (query.matchesNothing()) return List.of();
        List<Map<String, Object>> rows = store.findAll(md, query);
        return caller.isSystem() ? rows : access.filterDataByRole(rows, md, caller.role());
    }

    public int maxPageSize() {
        return maxPageSize;
    }

    private EntityMetadata metadata(String entity, CallerContext caller) {
        EntityMetadata md = registry.find(entity).orElseThrow(() -> ResourceNotFoundException.entity(entity));
        if (!caller.isSystem()) access.requireEntityPermission(md, caller.role(), Operation.READ);
        return md;
    }
}
