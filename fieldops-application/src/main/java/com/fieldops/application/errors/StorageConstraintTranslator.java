package com.fieldops.application.errors;

import com.fieldops.domain.DomainException;
import com.fieldops.domain.error.ConflictException;
import com.fieldops.domain.error.DeleteBlockedException;
import com.fieldops.domain.error.NotFoundReferenceException;
import com.fieldops.domain.error.ValidationFailedException;
import com.fieldops.domain.metadata.EntityMetadata;
import com.fieldops.domain.metadata.FieldLabels;
import com.fieldops.domain.metadata.ForeignKeyRef;
import com.fieldops.domain.metadata.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single point where storage constraint violations become domain errors.
 *
 * <p>The category comes from the {@link ConstraintKind} the adapter assigned, never from message text. Message text is
 * only mined for the offending field and, for blocked deletes, the referencing table. That mining is best effort;
 * when it finds nothing the message uses a generic label.
 */
public class StorageConstraintTranslator {

    private static final Logger log = LoggerFactory.getLogger(StorageConstraintTranslator.class);

    static final String FALLBACK_FIELD = "field";

    private static final Pattern KEY_COLUMN = Pattern.compile("Key \\(([^)]+)\\)");
    private static final Pattern FROM_TABLE = Pattern.compile("from table \"?([A-Za-z0-9_.]+)\"?");
    private static final Pattern COLUMN_QUOTED = Pattern.compile("column \"([^\"]+)\"");

    /**
     * @return the domain error, or {@link StorageFailureException} for kinds with no domain meaning
     */
    public RuntimeException translate(StorageConstraintException error, EntityMetadata metadata, Operation operation) {
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(metadata, "metadata");
        ConstraintViolation v = error.violation();
        String field = extractField(v, metadata);

        RuntimeException out = switch (v.kind()) {
            case FOREIGN_KEY -> operation == Operation.DELETE
                    ? deleteBlocked(v, metadata)
                    : notFoundReference(field, metadata);
            case UNIQUE -> new ConflictException(field, label(field, metadata) + " already exists");
            case CHECK -> new ValidationFailedException(orFallback(field),
                    "Invalid value for " + orFallback(field) + ". Please check allowed values.");
            case NOT_NULL -> new ValidationFailedException(orFallback(field),
                    (field == null ? "Required field" : field) + " cannot be empty");
            case INVALID_DATETIME -> new ValidationFailedException(field,
                    "Invalid date format. Please use YYYY-MM-DD format.");
            case NUMERIC_OUT_OF_RANGE -> new ValidationFailedException(field,
                    "Numeric value is out of allowed range");
            case INVALID_TEXT_REPRESENTATION -> new ValidationFailedException(field,
                    "Invalid data format provided");
            case UNKNOWN -> new StorageFailureException(error);
        };

        if (out instanceof DomainException de) {
            log.warn("[DB_CONSTRAINT] entity={} op={} kind={} sqlState={} field={} category={}",
                    metadata.entityName(), operation.key(), v.kind(), v.sqlState(), field, de.category().code());
        } else {
            log.warn("[DB_CONSTRAINT] entity={} op={} kind={} sqlState={} untranslated",
                    metadata.entityName(), operation.key(), v.kind(), v.sqlState(), error);
        }
        return out;
    }

    /**
     * Column reported by the engine, else {@code Key (col)} in the detail, else the longest known field name found in
     * the constraint name or message. Null when nothing matches.
     */
    String extractField(ConstraintViolation v, EntityMetadata metadata) {
        if (notBlank(v.columnName())) return v.columnName();

        String fromDetail = firstGroup(KEY_COLUMN, v.detail());
        if (fromDetail != null) {
            // composite keys report "a, b"; the first column is the best guess
            return fromDetail.split(",")[0].trim();
        }

        String quoted = firstGroup(COLUMN_QUOTED, v.message());
        if (quoted != null) return quoted;

        Set<String> known = new LinkedHashSet<>(metadata.fields().keySet());
        known.addAll(metadata.foreignKeys().keySet());
        if (metadata.identityField() != null) known.add(metadata.identityField());

        String haystack = ((v.constraintName() == null ? "" : v.constraintName()) + " "
                + (v.message() == null ? "" : v.message())).toLowerCase(Locale.ROOT);
        return known.stream()
                .filter(f -> haystack.contains(f.toLowerCase(Locale.ROOT)))
                .max(Comparator.comparingInt(String::length))
                .orElse(null);
    }

    private DeleteBlockedException deleteBlocked(ConstraintViolation v, EntityMetadata metadata) {
        String table = firstGroup(FROM_TABLE, v.detail());
        if (table == null) table = firstGroup(FROM_TABLE, v.message());
        String shown = table == null ? "other records" : table;
        return new DeleteBlockedException(table,
                "Cannot delete " + metadata.displayName().toLowerCase(Locale.ROOT) + ": it is still referenced by "
                        + shown + ". Please remove or reassign the dependent records first.");
    }

    private NotFoundReferenceException notFoundReference(String field, EntityMetadata metadata) {
        ForeignKeyRef ref = field == null ? null : metadata.foreignKeys().get(field);
        String referenced = ref == null ? "Referenced resource" : ref.displayName();
        return new NotFoundReferenceException(field, ref == null ? null : ref.table(),
                referenced + " not found. Please provide a valid " + (field == null ? "reference" : field) + ".");
    }

    private static String label(String field, EntityMetadata metadata) {
        if (field == null) return "Value";
        ForeignKeyRef ref = metadata.foreignKeys().get(field);
        return ref != null ? ref.displayName() : FieldLabels.humanize(field);
    }

    private static String orFallback(String field) {
        return field == null ? FALLBACK_FIELD : field;
    }

    private static String firstGroup(Pattern p, String text) {
        if (text == null) return null;
        Matcher m = p.matcher(text);
        return m.find() ? m.group(1) : null;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
