package com.fieldops.application.service;

import com.fieldops.application.access.FieldAccessController;
import com.fieldops.application.errors.StorageConstraintException;
import com.fieldops.application.errors.StorageConstraintTranslator;
import com.fieldops.application.hygiene.DataHygiene;
import com.fieldops.application.identifier.IdentifierGenerator;
import com.fieldops.application.metadata.MetadataRegistry;
import com.fieldops.application.ports.EntityWriteObserver;
import com.fieldops.application.ports.RecordStore;
import com.fieldops.application.role.RoleHierarchyResolver;
import com.fieldops.application.validation.ValidationSchemaBuilder;
import com.fieldops.domain.DomainException;
import com.fieldops.domain.error.ConflictException;
import com.fieldops.domain.error.FieldViolation;
import com.fieldops.domain.error.ValidationFailedException;
import com.fieldops.domain.error.ViolationKind;
import com.fieldops.domain.metadata.EntityMetadata;
import com.fieldops.domain.metadata.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Create, update and delete for any registered entity.
 *
 * <p>Write path: entity permission, hygiene, field access (all denied fields at once), schema validation,
 * writable-field filter, persistence, constraint translation on failure, audit, read-side projection.
 *
 * <p>Identifiers minted here are candidates. If the insert fails with a conflict on the identity field, a fresh
 * identifier is generated and the insert retried, up to {@code maxIdentifierAttempts} times.
 */
public class EntityWriteService {

    private static final Logger log = LoggerFactory.getLogger(EntityWriteService.class);

    private final MetadataRegistry registry;
    private final RoleHierarchyResolver roles;
    private final DataHygiene hygiene;
    private final FieldAccessController access;
    private final ValidationSchemaBuilder schemas;
    private final IdentifierGenerator identifiers;
    private final RecordStore store;
    private final StorageConstraintTranslator translator;
    private final AuditEmitter audit;
    private final EntityWriteObserver observer;
    private final int maxIdentifierAttempts;

    public EntityWriteService(
            MetadataRegistry registry,
            RoleHierarchyResolver roles,
            DataHygiene hygiene,
            FieldAccessController access,
            ValidationSchemaBuilder schemas,
            IdentifierGenerator identifiers,
            RecordStore store,
            StorageConstraintTranslator translator,
            AuditEmitter audit,
            EntityWriteObserver observer,
            int maxIdentifierAttempts
    ) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.roles = Objects.requireNonNull(roles, "roles");
        this.hygiene = Objects.requireNonNull(hygiene, "hygiene");
        this.access = Objects.requireNonNull(access, "access");
        this.schemas = Objects.requireNonNull(schemas, "schemas");
        this.identifiers = Objects.requireNonNull(identifiers, "identifiers");
        this.store = Objects.requireNonNull(store, "store");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.observer = observer == null ? new EntityWriteObserver() {} : observer;
        if (maxIdentifierAttempts < 1) throw new IllegalArgumentException("maxIdentifierAttempts must be >= 1");
        this.maxIdentifierAttempts = maxIdentifierAttempts;
    }

    public Map<String, Object> create(String entity, Map<String, Object> payload, CallerContext caller) {
        EntityMetadata md = metadata(entity);
        Object role = caller.role();

        if (!caller.isSystem()) access.requireEntityPermission(md, role, Operation.CREATE);
        Map<String, Object> clean = hygiene.sanitizePayload(payload, md);
        if (!caller.isSystem()) access.validateFieldAccess(clean, md, role, Operation.CREATE);

        Map<String, Object> values = schemas.buildEntitySchema(md, Operation.CREATE, role).validateOrThrow(clean);
        if (!caller.isSystem()) values = access.filterWritableFields(values, md, role, Operation.CREATE);

        Map<String, Object> stored = insertWithIdentifier(md, values);

        audit.emit(md.entityName() + "_create", md.tableName(), stored.get(md.primaryKey()),
                null, stored, actorRole(caller), caller);
        observer.onWriteCompleted(md.entityName(), Operation.CREATE.key());
        return project(stored, md, caller);
    }

    public Map<String, Object> update(String entity, Object id, Map<String, Object> payload, CallerContext caller) {
        EntityMetadata md = metadata(entity);
        Object role = caller.role();

        if (!caller.isSystem()) access.requireEntityPermission(md, role, Operation.UPDATE);
        Map<String, Object> clean = hygiene.sanitizePayload(payload, md);
        if (!caller.isSystem()) access.validateFieldAccess(clean, md, role, Operation.UPDATE);
        rejectImmutable(md, clean);

        Map<String, Object> values = schemas.buildEntitySchema(md, Operation.UPDATE, role).validateOrThrow(clean);
        if (!caller.isSystem()) values = access.filterWritableFields(values, md, role, Operation.UPDATE);
        if (values.isEmpty()) {
            throw new ValidationFailedException(null, "No updatable fields provided");
        }

        Map<String, Object> before = store.findById(md, id)
                .orElseThrow(() -> ResourceNotFoundException.record(md.entityName(), id));

        Map<String, Object> after;
        try {
            after = store.update(md, id, values)
                    .orElseThrow(() -> ResourceNotFoundException.record(md.entityName(), id));
        } catch (StorageConstraintException e) {
            throw translated(e, md, Operation.UPDATE);
        }

        audit.emit(md.entityName() + "_update", md.tableName(), id, before, after, actorRole(caller), caller);
        observer.onWriteCompleted(md.entityName(), Operation.UPDATE.key());
        return project(after, md, caller);
    }

    public void delete(String entity, Object id, CallerContext caller) {
        EntityMetadata md = metadata(entity);
        if (!caller.isSystem()) access.requireEntityPermission(md, caller.role(), Operation.DELETE);

        Map<String, Object> before = store.findById(md, id)
                .orElseThrow(() -> ResourceNotFoundException.record(md.entityName(), id));

        boolean deleted;
        try {
            deleted = store.delete(md, id);
        } catch (StorageConstraintException e) {
            throw translated(e, md, Operation.DELETE);
        }
        if (!deleted) throw ResourceNotFoundException.record(md.entityName(), id);

        audit.emit(md.entityName() + "_delete", md.tableName(), id, before, null, actorRole(caller), caller);
        observer.onWriteCompleted(md.entityName(), Operation.DELETE.key());
    }

    private Map<String, Object> insertWithIdentifier(EntityMetadata md, Map<String, Object> values) {
        boolean mint = md.mintsIdentifier() && DataHygiene.isEmpty(values.get(md.identityField()));
        int attempts = mint ? maxIdentifierAttempts : 1;

        for (int attempt = 1; ; attempt++) {
            Map<String, Object> row = new LinkedHashMap<>(values);
            if (mint) row.put(md.identityField(), identifiers.generateIdentifier(md));
            try {
                return store.insert(md, row);
            } catch (StorageConstraintException e) {
                RuntimeException t = translator.translate(e, md, Operation.CREATE);
                boolean collision = mint
                        && t instanceof ConflictException ce
                        && md.identityField().equals(ce.field());
                if (collision) {
                    observer.onIdentifierCollision(md.entityName(), (String) row.get(md.identityField()), attempt);
                    log.warn("[IDENT] collision entity={} identifier={} attempt={}/{}",
                            md.entityName(), row.get(md.identityField()), attempt, attempts);
                    if (attempt < attempts) continue;
                }
                throw reported(t, md);
            }
        }
    }

    private static void rejectImmutable(EntityMetadata md, Map<String, Object> payload) {
        List<FieldViolation> violations = new ArrayList<>();
        for (String field : payload.keySet()) {
            if (md.isImmutable(field)) {
                violations.add(new FieldViolation(field, ViolationKind.IMMUTABLE, field + " cannot be modified"));
            }
        }
        if (!violations.isEmpty()) throw new ValidationFailedException(violations);
    }

    private RuntimeException translated(StorageConstraintException e, EntityMetadata md, Operation op) {
        return reported(translator.translate(e, md, op), md);
    }

    private RuntimeException reported(RuntimeException t, EntityMetadata md) {
        if (t instanceof DomainException de) observer.onConstraintTranslated(md.entityName(), de.category());
        return t;
    }

    private Map<String, Object> project(Map<String, Object> stored, EntityMetadata md, CallerContext caller) {
        return caller.isSystem() ? stored : access.filterDataByRole(stored, md, caller.role());
    }

    private String actorRole(CallerContext caller) {
        return caller.isSystem() ? "system" : roles.normalizeRoleName(caller.role());
    }

    private EntityMetadata metadata(String entity) {
        return registry.find(entity).orElseThrow(() -> ResourceNotFoundException.entity(entity));
    }
}
