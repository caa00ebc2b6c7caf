package dbexec;

import java.sql.SQLException;
import java.util.Objects;

/**
 * Handle on the single row returned by {@link Executor#queryRow}.
 *
 * <p>Any failure of the query is deferred to {@link #scan(RowMapper)}. An empty result
 * fails with {@link NoRowsException}. Scanning releases the underlying resources; a row
 * that is never scanned keeps them until its owner is closed.
 */
public interface Row {

  /**
   * Maps the first row of the result.
   *
   * @throws NoRowsException if the query returned no rows
   * @throws SQLException    if the query failed
   */
  <T> T scan(RowMapper<T> mapper) throws SQLException;

  /**
   * Reads the first column of the first row.
   */
  default <T> T scalar(Class<T> type) throws SQLException {
    return scan(rs -> rs.getObject(1, type));
  }

  /**
   * Returns a row whose {@link #scan(RowMapper)} always throws {@code failure}.
   */
  static Row failed(SQLException failure) {
    Objects.requireNonNull(failure, "failure");
    return new Row() {
      @Override
      public <T> T scan(RowMapper<T> mapper) throws SQLException {
        throw failure;
      }
    };
  }
}
