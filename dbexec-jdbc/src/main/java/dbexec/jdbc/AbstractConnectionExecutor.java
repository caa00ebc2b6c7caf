package dbexec.jdbc;

import dbexec.Batch;
import dbexec.BatchResults;
import dbexec.CommandTag;
import dbexec.CopyFromSource;
import dbexec.CopyStatements;
import dbexec.ExecContext;
import dbexec.Executor;
import dbexec.ExecutorConfig;
import dbexec.ExecutorKind;
import dbexec.Identifier;
import dbexec.Operation;
import dbexec.Row;
import dbexec.Rows;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * {@link Executor} that runs every operation on a JDBC connection borrowed for the duration
 * of the call (or of the returned cursor, row or batch results).
 *
 * <p>Subclasses decide where the connection comes from: the pool hands out a fresh one per
 * call, a transaction always returns its own.
 */
public abstract class AbstractConnectionExecutor implements Executor {
  protected final ExecutorConfig config;

  protected AbstractConnectionExecutor(ExecutorConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Borrows the connection for one operation.
   */
  protected abstract Connection acquire() throws SQLException;

  /**
   * Gives back a connection obtained from {@link #acquire()}.
   */
  protected abstract void release(Connection connection) throws SQLException;

  /**
   * Which kind of executor this is, for metrics.
   */
  public abstract ExecutorKind kind();

  @Override
  public CommandTag exec(ExecContext ctx, String sql, Object... args) throws SQLException {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(sql, "sql");
    return withConnection(Operation.EXEC, connection -> {
      try (PreparedStatement ps = JdbcSupport.prepare(connection, sql, config.effectiveTimeout(ctx), args)) {
        return JdbcSupport.execute(ps, sql);
      }
    });
  }

  @Override
  public Rows query(ExecContext ctx, String sql, Object... args) throws SQLException {
    return openRows(ctx, Operation.QUERY, sql, args);
  }

  @Override
  public Row queryRow(ExecContext ctx, String sql, Object... args) {
    try {
      return new JdbcRow(openRows(ctx, Operation.QUERY_ROW, sql, args));
    } catch (SQLException e) {
      return Row.failed(e);
    }
  }

  @Override
  public BatchResults sendBatch(ExecContext ctx, Batch batch) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(batch, "batch");
    long started = System.nanoTime();
    config.getMetrics().incrementBatchStatements(kind(), batch.size());
    Connection connection;
    try {
      connection = acquire();
    } catch (SQLException e) {
      record(Operation.SEND_BATCH, started, true);
      return JdbcBatchResults.failed(e);
    }
    try {
      boolean implicitTx = connection.getAutoCommit();
      if (implicitTx) {
        connection.setAutoCommit(false);
      }
      record(Operation.SEND_BATCH, started, false);
      return new JdbcBatchResults(batch.statements(), connection, config.effectiveTimeout(ctx),
          implicitTx, () -> release(connection));
    } catch (SQLException e) {
      releaseAfterFailure(connection, e);
      record(Operation.SEND_BATCH, started, true);
      return JdbcBatchResults.failed(e);
    }
  }

  @Override
  public long copyFrom(ExecContext ctx, Identifier table, List<String> columns, CopyFromSource source)
      throws SQLException {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(source, "source");
    // fail fast on an empty column list before borrowing a connection
    CopyStatements.insert(table, columns);
    long copied = withConnection(Operation.COPY_FROM, connection -> JdbcCopy.copy(connection, table,
        columns, source, config.getCopyChunkSize(), config.effectiveTimeout(ctx)));
    config.getMetrics().incrementRowsCopied(kind(), copied);
    return copied;
  }

  private Rows openRows(ExecContext ctx, Operation operation, String sql, Object[] args)
      throws SQLException {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(sql, "sql");
    long started = System.nanoTime();
    Connection connection;
    try {
      connection = acquire();
    } catch (SQLException e) {
      record(operation, started, true);
      throw e;
    }
    PreparedStatement ps = null;
    try {
      ps = JdbcSupport.prepare(connection, sql, config.effectiveTimeout(ctx), args);
      ResultSet rs = ps.executeQuery();
      record(operation, started, false);
      return new JdbcRows(ps, rs, () -> release(connection));
    } catch (SQLException | RuntimeException e) {
      JdbcSupport.closeAfterFailure(ps, e);
      releaseAfterFailure(connection, e);
      record(operation, started, true);
      throw e;
    }
  }

  private <T> T withConnection(Operation operation, ConnectionCallback<T> callback) throws SQLException {
    long started = System.nanoTime();
    Connection connection;
    try {
      connection = acquire();
    } catch (SQLException e) {
      record(operation, started, true);
      throw e;
    }
    T result;
    try {
      result = callback.doInConnection(connection);
    } catch (SQLException | RuntimeException e) {
      releaseAfterFailure(connection, e);
      record(operation, started, true);
      throw e;
    }
    release(connection);
    record(operation, started, false);
    return result;
  }

  private void releaseAfterFailure(Connection connection, Throwable primary) {
    try {
      release(connection);
    } catch (SQLException | RuntimeException e) {
      primary.addSuppressed(e);
    }
  }

  private void record(Operation operation, long startedNanos, boolean failed) {
    config.getMetrics().recordStatement(kind(), operation, System.nanoTime() - startedNanos, failed);
  }

  @FunctionalInterface
  private interface ConnectionCallback<T> {
    T doInConnection(Connection connection) throws SQLException;
  }
}
