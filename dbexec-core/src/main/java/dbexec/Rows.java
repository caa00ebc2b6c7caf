package dbexec;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Forward-only, single-pass cursor over a query result.
 *
 * <p>Rows are fetched lazily. The cursor holds database resources (and, for the pool, a
 * connection) until it is closed; {@link #next()} closes it automatically when it returns
 * {@code false}. Column indexes are 1-based, as in JDBC.
 */
public interface Rows extends AutoCloseable {

  /**
   * Advances to the next row.
   *
   * @return {@code false} once the rows are exhausted or closed
   */
  boolean next() throws SQLException;

  List<String> columnNames() throws SQLException;

  Object get(int column) throws SQLException;

  <T> T get(int column, Class<T> type) throws SQLException;

  /**
   * Returns all values of the current row.
   */
  Object[] values() throws SQLException;

  /**
   * Maps the current row.
   */
  <T> T map(RowMapper<T> mapper) throws SQLException;

  /**
   * Releases the cursor. Idempotent.
   */
  @Override
  void close() throws SQLException;

  /**
   * Maps every remaining row and closes the cursor.
   */
  default <T> List<T> collect(RowMapper<T> mapper) throws SQLException {
    try (Rows rows = this) {
      List<T> results = new ArrayList<>();
      while (rows.next()) {
        results.add(rows.map(mapper));
      }
      return results;
    }
  }
}
