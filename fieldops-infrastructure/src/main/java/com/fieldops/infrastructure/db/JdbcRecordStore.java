package com.fieldops.infrastructure.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.application.errors.ConstraintKind;
import com.fieldops.application.errors.ConstraintViolation;
import com.fieldops.application.errors.StorageConstraintException;
import com.fieldops.application.errors.StorageFailureException;
import com.fieldops.application.ports.RecordStore;
import com.fieldops.application.query.FilterCondition;
import com.fieldops.application.query.FilterOperator;
import com.fieldops.application.query.ListQuery;
import com.fieldops.domain.metadata.EntityMetadata;
import com.fieldops.domain.metadata.FieldDef;
import com.fieldops.domain.metadata.SemanticType;
import com.fieldops.domain.metadata.SortDirection;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Date;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * {@link RecordStore} over plain JDBC. SQL is assembled from metadata, so every table and column name is checked
 * against the entity definition and a strict identifier pattern before it reaches a statement; values always
 * travel as bind parameters.
 *
 * <p>Every table is expected to have a BIGINT identity primary key plus {@code created_at} and {@code updated_at};
 * the latter is touched on update.
 */
public final class JdbcRecordStore implements RecordStore {

  static final Pattern SQL_NAME = Pattern.compile("[a-z_][a-z0-9_]*");

  private static final TypeReference<Object> ANY_JSON = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbc;
  private final TransactionTemplate tx;
  private final ObjectMapper json;
  private final SqlConstraintClassifier classifier;

  public JdbcRecordStore(NamedParameterJdbcTemplate jdbc, PlatformTransactionManager txManager,
                         ObjectMapper json, SqlConstraintClassifier classifier) {
    this.jdbc = jdbc;
    this.tx = new TransactionTemplate(txManager);
    this.json = json;
    this.classifier = classifier;
  }

  @Override
  public Map<String, Object> insert(EntityMetadata md, Map<String, Object> values) {
    String table = sqlName(md.tableName());
    String pk = sqlName(md.primaryKey());
    MapSqlParameterSource params = new MapSqlParameterSource();
    List<String> columns = new ArrayList<>();
    List<String> binds = new ArrayList<>();
    for (Map.Entry<String, Object> e : values.entrySet()) {
      String col = column(md, e.getKey());
      columns.add(col);
      binds.add(":" + col);
      params.addValue(col, toDb(md.field(col), e.getValue()));
    }
    String sql = columns.isEmpty()
        ? "INSERT INTO " + table + " DEFAULT VALUES"
        : "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES (" + String.join(", ", binds) + ")";

    return guarded(() -> {
      KeyHolder keys = new GeneratedKeyHolder();
      jdbc.update(sql, params, keys, new String[] {pk});
      Object id = generatedId(keys, pk);
      return findById(md, id).orElseThrow(() ->
          new StorageFailureException(new IllegalStateException("inserted row not found: " + table + "." + id)));
    });
  }

  @Override
  public Optional<Map<String, Object>> findById(EntityMetadata md, Object id) {
    Long key = coerceId(id);
    if (key == null) return Optional.empty();
    String sql = "SELECT * FROM " + sqlName(md.tableName()) + " WHERE " + sqlName(md.primaryKey()) + " = :id";
    return guarded(() -> {
      try {
        Map<String, Object> row = jdbc.queryForObject(sql, Map.of("id", key), new ColumnMapRowMapper());
        return Optional.ofNullable(row).map(r -> fromDb(md, r));
      } catch (EmptyResultDataAccessException notFound) {
        return Optional.empty();
      }
    });
  }

  @Override
  public List<Map<String, Object>> findAll(EntityMetadata md, ListQuery query) {
    if (query.matchesNothing()) return List.of();
    String pk = sqlName(md.primaryKey());
    MapSqlParameterSource params = new MapSqlParameterSource();
    List<String> where = new ArrayList<>();

    if (query.hasSearch()) {
      List<String> any = new ArrayList<>();
      for (String f : query.searchFields()) {
        any.add("LOWER(" + queryColumn(md, f) + ") LIKE :__search ESCAPE '\\'");
      }
      where.add("(" + String.join(" OR ", any) + ")");
      params.addValue("__search", "%" + escapeLike(query.search().toLowerCase(Locale.ROOT)) + "%");
    }

    int n = 0;
    for (FilterCondition c : query.filters()) {
      String col = queryColumn(md, c.field());
      String p = "__f" + n++;
      FieldDef def = md.field(col);
      if (c.operator() == FilterOperator.IN) {
        params.addValue(p, c.values().stream().map(v -> toDb(def, v)).toList());
        where.add(col + " IN (:" + p + ")");
      } else {
        params.addValue(p, toDb(def, c.value()));
        where.add(col + " " + comparison(c.operator()) + " :" + p);
      }
    }

    String sortCol = query.sortField() == null ? pk : queryColumn(md, query.sortField());
    String dir = query.direction() == SortDirection.DESC ? "DESC" : "ASC";
    String order = sortCol + " " + dir + " NULLS LAST" + (sortCol.equals(pk) ? "" : ", " + pk + " ASC");

    String sql = "SELECT * FROM " + sqlName(md.tableName())
        + (where.isEmpty() ? "" : " WHERE " + String.join(" AND ", where))
        + " ORDER BY " + order + " LIMIT :__limit OFFSET :__offset";
    params.addValue("__limit", query.limit());
    params.addValue("__offset", query.offset());

    return guarded(() -> jdbc.query(sql, params, new ColumnMapRowMapper())
        .stream()
        .map(r -> fromDb(md, r))
        .toList());
  }

  @Override
  public Optional<Map<String, Object>> update(EntityMetadata md, Object id, Map<String, Object> values) {
    Long key = coerceId(id);
    if (key == null) return Optional.empty();
    MapSqlParameterSource params = new MapSqlParameterSource("__id", key);
    List<String> sets = new ArrayList<>();
    for (Map.Entry<String, Object> e : values.entrySet()) {
      String col = column(md, e.getKey());
      sets.add(col + " = :" + col);
      params.addValue(col, toDb(md.field(col), e.getValue()));
    }
    sets.add("updated_at = CURRENT_TIMESTAMP");
    String sql = "UPDATE " + sqlName(md.tableName()) + " SET " + String.join(", ", sets)
        + " WHERE " + sqlName(md.primaryKey()) + " = :__id";

    return guarded(() -> tx.execute(status -> {
      int n = jdbc.update(sql, params);
      return n == 0 ? Optional.<Map<String, Object>>empty() : findById(md, key);
    }));
  }

  @Override
  public boolean delete(EntityMetadata md, Object id) {
    Long key = coerceId(id);
    if (key == null) return false;
    String table = sqlName(md.tableName());
    String pk = sqlName(md.primaryKey());

    return guarded(() -> Boolean.TRUE.equals(tx.execute(status -> {
      String identifier = null;
      if (md.identityField() != null) {
        List<String> found = jdbc.queryForList(
            "SELECT " + sqlName(md.identityField()) + " FROM " + table + " WHERE " + pk + " = :id",
            Map.of("id", key), String.class);
        identifier = found.isEmpty() ? null : found.get(0);
      }
      int n = jdbc.update("DELETE FROM " + table + " WHERE " + pk + " = :id", Map.of("id", key));
      if (n == 0) return false;
      if (identifier != null) {
        jdbc.update(
            "INSERT INTO retired_identifiers (table_name, identifier, retired_at) "
                + "VALUES (:table, :identifier, CURRENT_TIMESTAMP)",
            Map.of("table", md.tableName(), "identifier", identifier));
      }
      return true;
    })));
  }

  private <T> T guarded(Supplier<T> work) {
    try {
      return work.get();
    } catch (DataAccessException e) {
      ConstraintViolation v = classifier.classify(e);
      if (v.kind() == ConstraintKind.UNKNOWN) {
        throw new StorageFailureException(e);
      }
      throw new StorageConstraintException(v, e);
    }
  }

  private static String column(EntityMetadata md, String name) {
    String col = sqlName(name);
    if (!md.fields().containsKey(col) && !col.equals(md.identityField())) {
      throw new IllegalArgumentException("Column not defined for " + md.entityName() + ": " + name);
    }
    return col;
  }

  // list reads may also touch the primary key and the shared timestamp columns
  private static String queryColumn(EntityMetadata md, String name) {
    String col = sqlName(name);
    if (!md.hasColumn(col)) {
      throw new IllegalArgumentException("Column not defined for " + md.entityName() + ": " + name);
    }
    return col;
  }

  private static String comparison(FilterOperator op) {
    return switch (op) {
      case EQ -> "=";
      case NOT -> "<>";
      case GT -> ">";
      case GTE -> ">=";
      case LT -> "<";
      case LTE -> "<=";
      case IN -> throw new IllegalArgumentException("IN has no single comparison");
    };
  }

  static String escapeLike(String term) {
    return term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  static String sqlName(String name) {
    if (name == null || !SQL_NAME.matcher(name).matches()) {
      throw new IllegalArgumentException("Illegal SQL identifier: " + name);
    }
    return name;
  }

  private Object toDb(FieldDef def, Object value) {
    if (value == null) return null;
    if (def != null && def.type() == SemanticType.OBJECT) {
      try {
        return json.writeValueAsString(value);
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Cannot serialize object value", e);
      }
    }
    return value;
  }

  private Map<String, Object> fromDb(EntityMetadata md, Map<String, Object> row) {
    Map<String, Object> out = new LinkedHashMap<>();
    row.forEach((k, v) -> {
      String name = k.toLowerCase(Locale.ROOT);
      out.put(name, readValue(md.field(name), v));
    });
    return out;
  }

  private Object readValue(FieldDef def, Object v) {
    if (v == null) return null;
    if (v instanceof Timestamp ts) return ts.toInstant().atOffset(ZoneOffset.UTC);
    if (v instanceof Date d) return d.toLocalDate();
    if (v instanceof Time t) return t.toLocalTime().toString();
    if (def != null && def.type() == SemanticType.OBJECT && v instanceof String s) {
      try {
        return json.readValue(s, ANY_JSON);
      } catch (JsonProcessingException e) {
        throw new StorageFailureException(e);
      }
    }
    return v;
  }

  private static Object generatedId(KeyHolder keys, String pk) {
    Map<String, Object> generated = keys.getKeys();
    if (generated == null || generated.isEmpty()) {
      throw new StorageFailureException(new IllegalStateException("no generated key returned"));
    }
    for (Map.Entry<String, Object> e : generated.entrySet()) {
      if (e.getKey().equalsIgnoreCase(pk)) return e.getValue();
    }
    return generated.values().iterator().next();
  }

  // primary keys are BIGINT identity columns; anything that is not a number cannot match a row
  static Long coerceId(Object id) {
    if (id instanceof Number n) return n.longValue();
    if (id == null) return null;
    String s = id.toString().trim();
    if (s.isEmpty() || s.length() > 18 || !s.chars().allMatch(Character::isDigit)) return null;
    return Long.parseLong(s);
  }
}
