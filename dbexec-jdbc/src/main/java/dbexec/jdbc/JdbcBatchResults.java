package dbexec.jdbc;

import dbexec.BatchResults;
import dbexec.CommandTag;
import dbexec.QueuedStatement;
import dbexec.Row;
import dbexec.Rows;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs queued statements one by one on a single connection as their results are read.
 *
 * <p>The first failure sticks: every later read and {@link #close()} report it. When the
 * connection was in auto-commit mode the batch runs in an implicit transaction, committed on
 * a clean close and rolled back otherwise.
 */
final class JdbcBatchResults implements BatchResults {
  private static final Logger logger = Logger.getLogger(JdbcBatchResults.class.getName());

  private final List<QueuedStatement> statements;
  private final Connection connection;
  private final Duration timeout;
  private final boolean implicitTx;
  private final Releaser releaser;
  private final SQLException setupFailure;

  private int index;
  private Rows current;
  private SQLException failure;
  private boolean closed;

  JdbcBatchResults(List<QueuedStatement> statements, Connection connection, Duration timeout,
      boolean implicitTx, Releaser releaser) {
    this(List.copyOf(statements), connection, timeout, implicitTx, releaser, null);
  }

  private JdbcBatchResults(List<QueuedStatement> statements, Connection connection, Duration timeout,
      boolean implicitTx, Releaser releaser, SQLException setupFailure) {
    this.statements = statements;
    this.connection = connection;
    this.timeout = timeout;
    this.implicitTx = implicitTx;
    this.releaser = releaser;
    this.setupFailure = setupFailure;
  }

  /** Results of a batch that could not be started; every read and close throw {@code failure}. */
  static JdbcBatchResults failed(SQLException failure) {
    return new JdbcBatchResults(List.of(), null, Duration.ZERO, false, Releaser.NONE, failure);
  }

  @Override
  public CommandTag exec() throws SQLException {
    QueuedStatement statement = advance();
    try (PreparedStatement ps = JdbcSupport.prepare(connection, statement.sql(), timeout,
        statement.argsArray())) {
      return JdbcSupport.execute(ps, statement.sql());
    } catch (SQLException e) {
      throw fail(e);
    }
  }

  @Override
  public Rows query() throws SQLException {
    QueuedStatement statement = advance();
    PreparedStatement ps = null;
    try {
      ps = JdbcSupport.prepare(connection, statement.sql(), timeout, statement.argsArray());
      ResultSet rs = ps.executeQuery();
      current = new JdbcRows(ps, rs, Releaser.NONE);
      return current;
    } catch (SQLException e) {
      JdbcSupport.closeAfterFailure(ps, e);
      throw fail(e);
    }
  }

  @Override
  public Row queryRow() {
    try {
      return new JdbcRow(query());
    } catch (SQLException e) {
      return Row.failed(e);
    }
  }

  @Override
  public void close() throws SQLException {
    if (closed) {
      return;
    }
    if (setupFailure != null) {
      closed = true;
      throw setupFailure;
    }
    try {
      drain();
    } catch (RuntimeException e) {
      closed = true;
      finishAfterFailure(e);
      throw e;
    }
    closed = true;
    if (failure != null) {
      finishAfterFailure(failure);
      throw failure;
    }
    finish();
  }

  private QueuedStatement advance() throws SQLException {
    if (setupFailure != null) {
      throw setupFailure;
    }
    if (closed) {
      throw new SQLException("batch results are closed");
    }
    if (failure != null) {
      throw failure;
    }
    try {
      closeCurrent();
    } catch (SQLException e) {
      throw fail(e);
    }
    if (index >= statements.size()) {
      throw new SQLException("no more results in batch");
    }
    return statements.get(index++);
  }

  private void drain() {
    while (failure == null && index < statements.size()) {
      try {
        statements.get(index).consume(this);
      } catch (SQLException e) {
        fail(e);
      }
    }
    if (failure == null) {
      try {
        closeCurrent();
      } catch (SQLException e) {
        fail(e);
      }
    }
  }

  private void closeCurrent() throws SQLException {
    if (current != null) {
      Rows rows = current;
      current = null;
      rows.close();
    }
  }

  private SQLException fail(SQLException e) {
    if (failure == null) {
      failure = e;
    }
    return e;
  }

  private void finish() throws SQLException {
    if (implicitTx) {
      try {
        connection.commit();
      } catch (SQLException e) {
        finishAfterFailure(e);
        throw e;
      }
    }
    restoreAndRelease();
  }

  private void finishAfterFailure(Throwable primary) {
    JdbcSupport.closeAfterFailure(current, primary);
    current = null;
    if (implicitTx) {
      logger.log(Level.FINE, "Rolling back implicit batch transaction", primary);
      try {
        connection.rollback();
      } catch (SQLException e) {
        primary.addSuppressed(e);
      }
    }
    try {
      restoreAndRelease();
    } catch (SQLException e) {
      primary.addSuppressed(e);
    }
  }

  private void restoreAndRelease() throws SQLException {
    try {
      if (implicitTx) {
        connection.setAutoCommit(true);
      }
    } finally {
      releaser.release();
    }
  }
}
