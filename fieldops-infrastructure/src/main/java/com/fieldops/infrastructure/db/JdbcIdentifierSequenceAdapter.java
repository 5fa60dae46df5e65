package com.fieldops.infrastructure.db;

import com.fieldops.application.ports.IdentifierSequencePort;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Highest identifier for a year across live rows and {@code retired_identifiers}.
 * Ordering by length first keeps numeric order once sequences outgrow four digits.
 */
public final class JdbcIdentifierSequenceAdapter implements IdentifierSequencePort {

  private static final Pattern YEAR_PREFIX = Pattern.compile("[A-Z]+-\\d{4}-");

  private final NamedParameterJdbcTemplate jdbc;

  public JdbcIdentifierSequenceAdapter(NamedParameterJdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public Optional<String> findMaxIdentifier(String tableName, String identifierField, String yearPrefix) {
    String table = JdbcRecordStore.sqlName(tableName);
    String field = JdbcRecordStore.sqlName(identifierField);
    if (yearPrefix == null || !YEAR_PREFIX.matcher(yearPrefix).matches()) {
      throw new IllegalArgumentException("Illegal identifier prefix: " + yearPrefix);
    }

    String sql = "SELECT ident FROM ("
        + " SELECT " + field + " AS ident FROM " + table + " WHERE " + field + " LIKE :pattern"
        + " UNION ALL"
        + " SELECT identifier AS ident FROM retired_identifiers"
        + " WHERE table_name = :table AND identifier LIKE :pattern"
        + ") candidates"
        + " ORDER BY LENGTH(ident) DESC, ident DESC"
        + " LIMIT 1";

    List<String> rows = jdbc.queryForList(sql,
        Map.of("pattern", yearPrefix + "%", "table", tableName), String.class);
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }
}
