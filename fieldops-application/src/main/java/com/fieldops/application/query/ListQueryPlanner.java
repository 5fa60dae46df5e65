package com.fieldops.application.query;

import com.fieldops.domain.error.ValidationFailedException;
import com.fieldops.domain.metadata.DefaultSort;
import com.fieldops.domain.metadata.EntityMetadata;
import com.fieldops.domain.metadata.FieldDef;
import com.fieldops.domain.metadata.SemanticType;
import com.fieldops.domain.metadata.SortDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a caller's {@link ListRequest} into a {@link ListQuery} over the entity's whitelisted columns.
 *
 * <p>Filters are strict: a filter on a field that is not filterable or not readable by the caller, an unknown
 * operator, or a value that does not fit the column type is a {@link ValidationFailedException}. Sorting is
 * lenient: an unusable sort field falls back to the entity's default order. Search covers only the searchable
 * fields the caller can read.
 */
public final class ListQueryPlanner {

    private static final Logger log = LoggerFactory.getLogger(ListQueryPlanner.class);

    static final int MAX_SEARCH_LENGTH = 200;
    static final int MAX_IN_VALUES = 100;

    private static final Pattern FILTER_KEY = Pattern.compile("([a-z_][a-z0-9_]*)(?:\\[([A-Za-z]+)])?");

    private ListQueryPlanner() {
    }

    /**
     * @param readable fields the caller may read
     */
    public static ListQuery plan(EntityMetadata md, Predicate<String> readable, ListRequest request,
                                 int limit, int offset) {
        String search = search(request.search());
        List<String> searchFields = md.searchableFields().stream().filter(readable).toList();

        List<FilterCondition> filters = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : request.filters().entrySet()) {
            for (String raw : e.getValue()) {
                filters.add(filter(md, readable, e.getKey(), raw));
            }
        }

        DefaultSort fallback = md.defaultSort();
        if (!readable.test(fallback.field())) {
            fallback = new DefaultSort(md.primaryKey(), fallback.direction());
        }
        String sortField = fallback.field();
        String sortBy = request.sortBy() == null ? null : request.sortBy().trim();
        if (sortBy != null && !sortBy.isEmpty()) {
            if (md.sortableFields().contains(sortBy) && readable.test(sortBy)) {
                sortField = sortBy;
            } else {
                log.debug("[LIST] sort ignored entity={} field={}", md.entityName(), sortBy);
            }
        }
        SortDirection direction = SortDirection.parse(request.sortOrder(), fallback.direction());

        return new ListQuery(search, searchFields, filters, sortField, direction, limit, offset);
    }

    private static String search(String term) {
        if (term == null) return null;
        String t = term.trim();
        if (t.isEmpty()) return null;
        if (t.length() > MAX_SEARCH_LENGTH) {
            throw new ValidationFailedException("search", "search must be at most " + MAX_SEARCH_LENGTH + " characters");
        }
        return t;
    }

    private static FilterCondition filter(EntityMetadata md, Predicate<String> readable, String key, String raw) {
        Matcher m = FILTER_KEY.matcher(key == null ? "" : key.trim());
        if (!m.matches()) throw new ValidationFailedException(key, "Cannot filter by " + key);
        String field = m.group(1);
        FilterOperator op = m.group(2) == null ? FilterOperator.EQ : FilterOperator.fromKey(m.group(2));
        if (op == null) {
            throw new ValidationFailedException(field, "Unknown filter operator '" + m.group(2) + "' for " + field);
        }
        // unreadable and undeclared fields look the same to the caller
        if (!md.filterableFields().contains(field) || !readable.test(field)) {
            throw new ValidationFailedException(field, "Cannot filter by " + field);
        }
        if (raw == null) throw new ValidationFailedException(field, "Invalid filter value for " + field);

        if (op != FilterOperator.IN) {
            return FilterCondition.of(field, op, coerce(md, field, raw));
        }
        List<Object> values = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (!part.isBlank()) values.add(coerce(md, field, part));
        }
        if (values.isEmpty() || values.size() > MAX_IN_VALUES) {
            throw new ValidationFailedException(field,
                    "in filter on " + field + " takes 1 to " + MAX_IN_VALUES + " values");
        }
        return new FilterCondition(field, op, values);
    }

    /** Converts a query-string value to the Java type the column holds. */
    static Object coerce(EntityMetadata md, String field, String raw) {
        String v = raw.trim();
        try {
            return switch (columnType(md, field)) {
                case INTEGER -> new BigDecimal(v).longValueExact();
                case DECIMAL, CURRENCY -> new BigDecimal(v);
                case BOOLEAN -> bool(v);
                case DATE -> LocalDate.parse(v);
                case TIMESTAMP -> timestamp(v);
                case ENUM -> v.toLowerCase(Locale.ROOT);
                default -> v;
            };
        } catch (ArithmeticException | DateTimeParseException | IllegalArgumentException e) {
            log.debug("[LIST] bad filter value entity={} field={} reason={}", md.entityName(), field, e.getMessage());
            throw new ValidationFailedException(field, "Invalid filter value for " + field + ": " + raw);
        }
    }

    private static SemanticType columnType(EntityMetadata md, String field) {
        FieldDef def = md.field(field);
        if (def != null) return def.type();
        if (field.equals(md.primaryKey())) return SemanticType.INTEGER;
        if (EntityMetadata.TIMESTAMP_COLUMNS.contains(field)) return SemanticType.TIMESTAMP;
        return SemanticType.STRING;
    }

    private static Boolean bool(String v) {
        if (v.equalsIgnoreCase("true")) return Boolean.TRUE;
        if (v.equalsIgnoreCase("false")) return Boolean.FALSE;
        throw new IllegalArgumentException("not a boolean: " + v);
    }

    // no offset means UTC; a bare date means its first instant
    private static OffsetDateTime timestamp(String v) {
        if (v.length() == 10) return LocalDate.parse(v).atStartOfDay().atOffset(ZoneOffset.UTC);
        try {
            return OffsetDateTime.parse(v);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(v).atOffset(ZoneOffset.UTC);
        }
    }
}
