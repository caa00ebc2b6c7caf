package dbexec.jdbc.tx;

import dbexec.ExecutorConfig;
import dbexec.ExecutorKind;
import dbexec.Transaction;
import dbexec.jdbc.AbstractConnectionExecutor;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * An active JDBC transaction. Every executor operation runs on the transaction's connection.
 * Supports explicit {@link #commit()} and {@link #rollback()}; if neither is called,
 * {@link #close()} rolls back.
 *
 * <p>After completion the connection is returned to the pool and further statements fail.
 * Not thread-safe.
 */
public final class JdbcTransaction extends AbstractConnectionExecutor implements Transaction {
  private static final Logger logger = Logger.getLogger(JdbcTransaction.class.getName());

  private final Connection connection;
  private final Integer restoreIsolation;
  private final List<Runnable> afterCommit = new ArrayList<>();
  private final List<Runnable> afterRollback = new ArrayList<>();
  private boolean completed;

  JdbcTransaction(Connection connection, Integer restoreIsolation, ExecutorConfig config) {
    super(config);
    this.connection = Objects.requireNonNull(connection, "connection");
    this.restoreIsolation = restoreIsolation;
  }

  @Override
  protected Connection acquire() throws SQLException {
    if (completed) {
      throw new SQLException("transaction already completed");
    }
    return connection;
  }

  @Override
  protected void release(Connection connection) {
  }

  @Override
  public ExecutorKind kind() {
    return ExecutorKind.TRANSACTION;
  }

  @Override
  public boolean isActive() {
    return !completed;
  }

  /**
   * Registers a callback to run after the transaction commits.
   *
   * @throws IllegalStateException if the transaction has completed
   */
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireActive();
    afterCommit.add(callback);
  }

  /**
   * Registers a callback to run after the transaction rolls back, including a rollback
   * caused by a failed commit.
   *
   * @throws IllegalStateException if the transaction has completed
   */
  public void afterRollback(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireActive();
    afterRollback.add(callback);
  }

  @Override
  public void commit() throws SQLException {
    if (completed) {
      return;
    }
    try {
      connection.commit();
      logger.fine("Transaction committed");
    } catch (SQLException e) {
      safeRollback(e);
      finalizeAfterFailure(e);
      throw e;
    }
    finalizeTx(true);
  }

  @Override
  public void rollback() throws SQLException {
    if (completed) {
      return;
    }
    try {
      connection.rollback();
      logger.fine("Transaction rolled back");
    } catch (SQLException e) {
      finalizeAfterFailure(e);
      throw e;
    }
    finalizeTx(false);
  }

  @Override
  public void close() throws SQLException {
    if (!completed) {
      rollback();
    }
  }

  private void requireActive() {
    if (completed) {
      throw new IllegalStateException("Transaction already completed");
    }
  }

  private void finalizeTx(boolean committed) throws SQLException {
    RuntimeException callbackException = runCallbacks(committed ? afterCommit : afterRollback);
    completed = true;
    afterCommit.clear();
    afterRollback.clear();
    SQLException cleanupFailure = null;
    try {
      connection.setAutoCommit(true);
      if (restoreIsolation != null) {
        connection.setTransactionIsolation(restoreIsolation);
      }
    } catch (SQLException e) {
      cleanupFailure = e;
    }
    try {
      connection.close();
    } catch (SQLException e) {
      if (cleanupFailure == null) cleanupFailure = e;
      else cleanupFailure.addSuppressed(e);
    }
    if (callbackException != null) {
      if (cleanupFailure != null) callbackException.addSuppressed(cleanupFailure);
      throw callbackException;
    }
    if (cleanupFailure != null) {
      throw cleanupFailure;
    }
  }

  private void finalizeAfterFailure(SQLException primary) {
    try {
      finalizeTx(false);
    } catch (SQLException | RuntimeException e) {
      primary.addSuppressed(e);
    }
  }

  private static RuntimeException runCallbacks(List<Runnable> callbacks) {
    RuntimeException first = null;
    for (Runnable callback : List.copyOf(callbacks)) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    return first;
  }

  private void safeRollback(SQLException primary) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      primary.addSuppressed(e);
    }
  }
}
