package com.fieldops.application.ports;

import com.fieldops.application.query.ListQuery;
import com.fieldops.domain.metadata.EntityMetadata;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generic row persistence keyed by entity metadata.
 *
 * <p>Constraint violations are reported as
 * {@link com.fieldops.application.errors.StorageConstraintException} tagged with a
 * {@link com.fieldops.application.errors.ConstraintKind}; anything else as
 * {@link com.fieldops.application.errors.StorageFailureException}.
 */
public interface RecordStore {

    /** Inserts and returns the stored row, including generated columns. */
    Map<String, Object> insert(EntityMetadata metadata, Map<String, Object> values);

    Optional<Map<String, Object>> findById(EntityMetadata metadata, Object id);

    /** Rows matching the query's search and filters, in its order, one page at a time. */
    List<Map<String, Object>> findAll(EntityMetadata metadata, ListQuery query);

    /** Updates the given columns and returns the stored row, or empty if the id does not exist. */
    Optional<Map<String, Object>> update(EntityMetadata metadata, Object id, Map<String, Object> values);

    /**
     * Deletes the row. When the entity mints identifiers, the row's identifier is retired in the same transaction.
     *
     * @return false if no row had this id
     */
    boolean delete(EntityMetadata metadata, Object id);
}
