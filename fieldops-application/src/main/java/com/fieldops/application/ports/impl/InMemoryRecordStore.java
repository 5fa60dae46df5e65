package com.fieldops.application.ports.impl;

import com.fieldops.application.errors.ConstraintKind;
import com.fieldops.application.errors.ConstraintViolation;
import com.fieldops.application.errors.StorageConstraintException;
import com.fieldops.application.ports.IdentifierSequencePort;
import com.fieldops.application.ports.RecordStore;
import com.fieldops.application.query.FilterCondition;
import com.fieldops.application.query.ListQuery;
import com.fieldops.domain.metadata.EntityMetadata;
import com.fieldops.domain.metadata.SortDirection;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Dev/test store. Enforces uniqueness of the primary key and of each entity's identity field the way a unique
 * constraint would, and keeps retired identifiers so they are never handed out again.
 */
public class InMemoryRecordStore implements RecordStore, IdentifierSequencePort {

    private final Map<String, TreeMap<Long, Map<String, Object>>> tables = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> ids = new ConcurrentHashMap<>();
    private final Set<String> retired = ConcurrentHashMap.newKeySet();

    @Override
    public synchronized Map<String, Object> insert(EntityMetadata metadata, Map<String, Object> values) {
        Objects.requireNonNull(metadata, "metadata");
        checkIdentityUnique(metadata, values, null);
        long id = ids.computeIfAbsent(metadata.tableName(), t -> new AtomicLong()).incrementAndGet();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(metadata.primaryKey(), id);
        row.putAll(values);
        table(metadata).put(id, row);
        return new LinkedHashMap<>(row);
    }

    @Override
    public synchronized Optional<Map<String, Object>> findById(EntityMetadata metadata, Object id) {
        Long key = key(id);
        if (key == null) return Optional.empty();
        Map<String, Object> row = table(metadata).get(key);
        return row == null ? Optional.empty() : Optional.of(new LinkedHashMap<>(row));
    }

    @Override
    public synchronized List<Map<String, Object>> findAll(EntityMetadata metadata, ListQuery query) {
        if (query.matchesNothing()) return List.of();
        String pk = metadata.primaryKey();
        String sortField = query.sortField() == null ? pk : query.sortField();
        Comparator<Object> values = InMemoryRecordStore::compareValues;
        if (query.direction() == SortDirection.DESC) values = values.reversed();
        // nulls sort last in both directions
        Comparator<Map<String, Object>> bySort = Comparator.comparing(r -> r.get(sortField),
                Comparator.nullsLast(values));
        Comparator<Map<String, Object>> order = bySort.thenComparing(r -> key(r.get(pk)),
                Comparator.nullsLast(Comparator.<Long>naturalOrder()));

        List<Map<String, Object>> out = new ArrayList<>();
        table(metadata).values().stream()
                .filter(r -> matchesSearch(r, query))
                .filter(r -> query.filters().stream().allMatch(c -> matches(r.get(c.field()), c)))
                .sorted(order)
                .skip(query.offset())
                .limit(query.limit())
                .forEach(r -> out.add(new LinkedHashMap<>(r)));
        return out;
    }

    @Override
    public synchronized Optional<Map<String, Object>> update(EntityMetadata metadata, Object id,
                                                             Map<String, Object> values) {
        Long key = key(id);
        Map<String, Object> row = key == null ? null : table(metadata).get(key);
        if (row == null) return Optional.empty();
        checkIdentityUnique(metadata, values, key);
        row.putAll(values);
        return Optional.of(new LinkedHashMap<>(row));
    }

    @Override
    public synchronized boolean delete(EntityMetadata metadata, Object id) {
        Long key = key(id);
        Map<String, Object> row = key == null ? null : table(metadata).remove(key);
        if (row == null) return false;
        if (metadata.identityField() != null && row.get(metadata.identityField()) != null) {
            retired.add(metadata.tableName() + "|" + row.get(metadata.identityField()));
        }
        return true;
    }

    @Override
    public synchronized Optional<String> findMaxIdentifier(String tableName, String identifierField,
                                                           String yearPrefix) {
        String retiredPrefix = tableName + "|";
        Stream<String> live = tables.getOrDefault(tableName, new TreeMap<>()).values().stream()
                .map(r -> r.get(identifierField))
                .filter(Objects::nonNull)
                .map(Object::toString);
        Stream<String> gone = retired.stream()
                .filter(r -> r.startsWith(retiredPrefix))
                .map(r -> r.substring(retiredPrefix.length()));
        return Stream.concat(live, gone)
                .filter(s -> s.startsWith(yearPrefix))
                .max(Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder()));
    }

    /** Inserts a row as-is, bypassing id generation. For seeding tests. */
    public synchronized void seed(EntityMetadata metadata, Map<String, Object> row) {
        long id = ids.computeIfAbsent(metadata.tableName(), t -> new AtomicLong()).incrementAndGet();
        Map<String, Object> copy = new LinkedHashMap<>(row);
        copy.putIfAbsent(metadata.primaryKey(), id);
        table(metadata).put(key(copy.get(metadata.primaryKey())), copy);
    }

    public synchronized int count(EntityMetadata metadata) {
        return table(metadata).size();
    }

    private void checkIdentityUnique(EntityMetadata metadata, Map<String, Object> values, Long self) {
        String field = metadata.identityField();
        if (field == null || values.get(field) == null) return;
        Object candidate = values.get(field);
        Set<Long> owners = new HashSet<>();
        table(metadata).forEach((id, r) -> {
            if (candidate.equals(r.get(field))) owners.add(id);
        });
        owners.remove(self);
        if (!owners.isEmpty()) {
            throw new StorageConstraintException(new ConstraintViolation(
                    ConstraintKind.UNIQUE,
                    "23505",
                    "duplicate key value violates unique constraint \"" + metadata.tableName() + "_" + field + "_key\"",
                    "Key (" + field + ")=(" + candidate + ") already exists.",
                    metadata.tableName() + "_" + field + "_key",
                    field,
                    metadata.tableName()), null);
        }
    }

    private TreeMap<Long, Map<String, Object>> table(EntityMetadata metadata) {
        return tables.computeIfAbsent(metadata.tableName(), t -> new TreeMap<>());
    }

    private static boolean matchesSearch(Map<String, Object> row, ListQuery query) {
        if (!query.hasSearch()) return true;
        String term = query.search().toLowerCase(Locale.ROOT);
        return query.searchFields().stream()
                .map(row::get)
                .anyMatch(v -> v != null && v.toString().toLowerCase(Locale.ROOT).contains(term));
    }

    // null never matches, as in SQL
    private static boolean matches(Object value, FilterCondition c) {
        if (value == null) return false;
        return switch (c.operator()) {
            case EQ -> compareValues(value, c.value()) == 0;
            case NOT -> compareValues(value, c.value()) != 0;
            case GT -> compareValues(value, c.value()) > 0;
            case GTE -> compareValues(value, c.value()) >= 0;
            case LT -> compareValues(value, c.value()) < 0;
            case LTE -> compareValues(value, c.value()) <= 0;
            case IN -> c.values().stream().anyMatch(v -> compareValues(value, v) == 0);
        };
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compareValues(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString()));
        }
        if (a instanceof Comparable ca && a.getClass() == b.getClass()) {
            return ca.compareTo(b);
        }
        return a.toString().compareTo(b.toString());
    }

    private static Long key(Object id) {
        if (id instanceof Number n) return n.longValue();
        if (id instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
