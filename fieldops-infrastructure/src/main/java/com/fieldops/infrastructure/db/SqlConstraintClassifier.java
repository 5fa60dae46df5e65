package com.fieldops.infrastructure.db;

import com.fieldops.application.errors.ConstraintKind;
import com.fieldops.application.errors.ConstraintViolation;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

import java.sql.SQLException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a driver exception into a {@link ConstraintViolation}.
 *
 * <p>PostgreSQL reports detail, constraint, column and table separately. H2 only has a message, so its
 * foreign-key and unique messages are rewritten into the PostgreSQL detail form ({@code Key (col)=...}).
 */
public final class SqlConstraintClassifier {

  private static final String NAME = "\"?(\\w+)\"?";
  private static final String QUALIFIED = "(?:\"?\\w+\"?\\.)?" + NAME;

  private static final Pattern H2_FOREIGN_KEY = Pattern.compile(
      QUALIFIED + "\\s+FOREIGN\\s+KEY\\s*\\(\\s*" + NAME + "\\s*\\)\\s+REFERENCES\\s+"
          + QUALIFIED + "\\s*\\(\\s*" + NAME + "\\s*\\)",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern H2_UNIQUE_INDEX = Pattern.compile(
      "\\bON\\s+" + QUALIFIED + "\\s*\\(\\s*" + NAME, Pattern.CASE_INSENSITIVE);
  private static final Pattern H2_COLUMN = Pattern.compile("column \"(\\w+)\"", Pattern.CASE_INSENSITIVE);

  public ConstraintViolation classify(Throwable error) {
    SQLException sql = findSqlException(error);
    if (sql == null) {
      return ConstraintViolation.of(ConstraintKind.UNKNOWN, error == null ? null : error.getMessage(), null);
    }
    String state = sql.getSQLState();
    ConstraintKind kind = kindFor(state);

    if (sql instanceof PSQLException psql && psql.getServerErrorMessage() != null) {
      ServerErrorMessage server = psql.getServerErrorMessage();
      return new ConstraintViolation(
          kind,
          state,
          server.getMessage(),
          server.getDetail(),
          server.getConstraint(),
          lower(server.getColumn()),
          lower(server.getTable()));
    }
    return fromMessage(kind, state, sql.getMessage());
  }

  static ConstraintKind kindFor(String sqlState) {
    if (sqlState == null) return ConstraintKind.UNKNOWN;
    return switch (sqlState) {
      // 23506 is H2's "parent missing"; PostgreSQL uses 23503 both ways
      case "23503", "23506" -> ConstraintKind.FOREIGN_KEY;
      case "23505" -> ConstraintKind.UNIQUE;
      case "23514", "23513" -> ConstraintKind.CHECK;
      case "23502" -> ConstraintKind.NOT_NULL;
      case "22007", "22008" -> ConstraintKind.INVALID_DATETIME;
      case "22003" -> ConstraintKind.NUMERIC_OUT_OF_RANGE;
      case "22P02", "22018" -> ConstraintKind.INVALID_TEXT_REPRESENTATION;
      default -> ConstraintKind.UNKNOWN;
    };
  }

  private ConstraintViolation fromMessage(ConstraintKind kind, String state, String message) {
    String detail = null;
    String column = null;
    String table = null;
    if (message != null) {
      switch (kind) {
        case FOREIGN_KEY -> {
          Matcher m = H2_FOREIGN_KEY.matcher(message);
          if (m.find()) {
            String child = lower(m.group(1));
            String childColumn = lower(m.group(2));
            String parent = lower(m.group(3));
            String parentColumn = lower(m.group(4));
            if ("23503".equals(state)) {
              detail = "Key (" + parentColumn + ")=(?) is still referenced from table \"" + child + "\".";
              table = parent;
            } else {
              detail = "Key (" + childColumn + ")=(?) is not present in table \"" + parent + "\".";
              column = childColumn;
              table = child;
            }
          }
        }
        case UNIQUE -> {
          Matcher m = H2_UNIQUE_INDEX.matcher(message);
          if (m.find()) {
            table = lower(m.group(1));
            column = lower(m.group(2));
            detail = "Key (" + column + ")=(?) already exists.";
          }
        }
        default -> {
          Matcher m = H2_COLUMN.matcher(message);
          if (m.find()) column = lower(m.group(1));
        }
      }
    }
    return new ConstraintViolation(kind, state, message, detail, null, column, table);
  }

  private static SQLException findSqlException(Throwable error) {
    Throwable t = error;
    SQLException found = null;
    while (t != null) {
      if (t instanceof SQLException s) {
        found = s;
        if (s.getSQLState() != null) return s;
      }
      if (t.getCause() == t) break;
      t = t.getCause();
    }
    return found;
  }

  private static String lower(String s) {
    return s == null ? null : s.toLowerCase(Locale.ROOT);
  }
}
