package dbexec.jdbc;

import dbexec.NoRowsException;
import dbexec.Row;
import dbexec.RowMapper;
import dbexec.Rows;

import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link Row} reading the first row of a cursor and closing it.
 */
final class JdbcRow implements Row {
  private final Rows rows;

  JdbcRow(Rows rows) {
    this.rows = Objects.requireNonNull(rows, "rows");
  }

  @Override
  public <T> T scan(RowMapper<T> mapper) throws SQLException {
    Objects.requireNonNull(mapper, "mapper");
    try (Rows r = rows) {
      if (!r.next()) {
        throw new NoRowsException();
      }
      return r.map(mapper);
    }
  }
}
