package dbexec.jdbc;

import dbexec.RowMapper;
import dbexec.Rows;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link Rows} over an open {@link ResultSet}. Closing releases the result set, its
 * statement and then the borrowed connection, if any.
 */
final class JdbcRows implements Rows {
  private final Statement statement;
  private final ResultSet resultSet;
  private final Releaser releaser;
  private boolean closed;

  JdbcRows(Statement statement, ResultSet resultSet, Releaser releaser) {
    this.statement = Objects.requireNonNull(statement, "statement");
    this.resultSet = Objects.requireNonNull(resultSet, "resultSet");
    this.releaser = Objects.requireNonNull(releaser, "releaser");
  }

  @Override
  public boolean next() throws SQLException {
    if (closed) {
      return false;
    }
    if (resultSet.next()) {
      return true;
    }
    close();
    return false;
  }

  @Override
  public List<String> columnNames() throws SQLException {
    requireOpen();
    ResultSetMetaData meta = resultSet.getMetaData();
    List<String> names = new ArrayList<>(meta.getColumnCount());
    for (int i = 1; i <= meta.getColumnCount(); i++) {
      names.add(meta.getColumnLabel(i));
    }
    return names;
  }

  @Override
  public Object get(int column) throws SQLException {
    requireOpen();
    return resultSet.getObject(column);
  }

  @Override
  public <T> T get(int column, Class<T> type) throws SQLException {
    requireOpen();
    return resultSet.getObject(column, type);
  }

  @Override
  public Object[] values() throws SQLException {
    requireOpen();
    int count = resultSet.getMetaData().getColumnCount();
    Object[] values = new Object[count];
    for (int i = 0; i < count; i++) {
      values[i] = resultSet.getObject(i + 1);
    }
    return values;
  }

  @Override
  public <T> T map(RowMapper<T> mapper) throws SQLException {
    Objects.requireNonNull(mapper, "mapper");
    requireOpen();
    return mapper.map(resultSet);
  }

  @Override
  public void close() throws SQLException {
    if (closed) {
      return;
    }
    closed = true;
    SQLException failure = null;
    try {
      resultSet.close();
    } catch (SQLException e) {
      failure = e;
    }
    try {
      statement.close();
    } catch (SQLException e) {
      failure = chain(failure, e);
    }
    try {
      releaser.release();
    } catch (SQLException e) {
      failure = chain(failure, e);
    }
    if (failure != null) {
      throw failure;
    }
  }

  private void requireOpen() throws SQLException {
    if (closed) {
      throw new SQLException("rows are closed");
    }
  }

  private static SQLException chain(SQLException first, SQLException next) {
    if (first == null) {
      return next;
    }
    first.addSuppressed(next);
    return first;
  }
}
