package dbexec.jdbc;

import dbexec.CommandTag;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Duration;

/**
 * Statement preparation, binding and cleanup shared by the JDBC executors.
 */
final class JdbcSupport {

  private JdbcSupport() {}

  /** Prepare {@code sql} with a timeout and bind {@code args}; the statement is closed on failure. */
  static PreparedStatement prepare(Connection connection, String sql, Duration timeout, Object... args)
      throws SQLException {
    PreparedStatement ps = connection.prepareStatement(sql);
    try {
      applyTimeout(ps, timeout);
      bindParams(ps, args);
      return ps;
    } catch (SQLException | RuntimeException e) {
      closeAfterFailure(ps, e);
      throw e;
    }
  }

  /** Execute and build the completion tag; rows of a query are counted, not kept. */
  static CommandTag execute(PreparedStatement ps, String sql) throws SQLException {
    if (ps.execute()) {
      long rows = 0;
      try (ResultSet rs = ps.getResultSet()) {
        while (rs.next()) {
          rows++;
        }
      }
      return CommandTag.of(sql, rows);
    }
    return CommandTag.of(sql, ps.getUpdateCount());
  }

  static void applyTimeout(Statement statement, Duration timeout) throws SQLException {
    if (timeout == null || timeout.isZero()) {
      return;
    }
    long seconds = timeout.getSeconds() + (timeout.getNano() > 0 ? 1 : 0);
    statement.setQueryTimeout((int) Math.min(Integer.MAX_VALUE, seconds));
  }

  static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    if (params == null) {
      return;
    }
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  /** Close {@code resource}, attaching any close failure to {@code primary}. */
  static void closeAfterFailure(AutoCloseable resource, Throwable primary) {
    if (resource == null) {
      return;
    }
    try {
      resource.close();
    } catch (Exception e) {
      primary.addSuppressed(e);
    }
  }
}
