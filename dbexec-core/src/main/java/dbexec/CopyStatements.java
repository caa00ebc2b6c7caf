package dbexec;

import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * SQL used to copy rows with plain JDBC: one parameterised {@code INSERT} per row.
 */
public final class CopyStatements {

  private CopyStatements() {}

  /**
   * Builds {@code INSERT INTO "table" ("a", "b") VALUES (?, ?)}, every name quoted as is.
   */
  public static String insert(Identifier table, List<String> columns) {
    return insert(table, columns, part -> Identifier.of(part).sanitize());
  }

  /**
   * Builds the {@code INSERT} with each table part and column rendered by {@code quote}.
   */
  public static String insert(Identifier table, List<String> columns, UnaryOperator<String> quote) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(columns, "columns");
    Objects.requireNonNull(quote, "quote");
    if (columns.isEmpty()) {
      throw new IllegalArgumentException("columns must not be empty");
    }
    String tableName = table.parts().stream()
        .map(quote)
        .collect(Collectors.joining("."));
    String columnList = columns.stream()
        .map(quote)
        .collect(Collectors.joining(", "));
    String placeholders = columns.stream()
        .map(column -> "?")
        .collect(Collectors.joining(", "));
    return "INSERT INTO " + tableName + " (" + columnList + ") VALUES (" + placeholders + ")";
  }

  /**
   * Returns {@code values} if it has exactly {@code columnCount} elements.
   *
   * @throws SQLException if the row has the wrong number of values
   */
  public static Object[] checkArity(Object[] values, int columnCount) throws SQLException {
    if (values == null || values.length != columnCount) {
      throw new SQLException("expected " + columnCount + " values, got "
          + (values == null ? "null" : values.length));
    }
    return values;
  }
}
