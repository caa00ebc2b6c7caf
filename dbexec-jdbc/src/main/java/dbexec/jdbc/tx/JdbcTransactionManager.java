package dbexec.jdbc.tx;

import dbexec.ExecutorConfig;
import dbexec.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Lightweight transaction manager for manual JDBC usage. Obtains a connection from the pool
 * and disables auto-commit; the returned {@link JdbcTransaction} owns the connection until it
 * completes.
 *
 * <p>Use via try-with-resources and inject the transaction for downstream code:
 * <pre>{@code
 * try (JdbcTransaction tx = txManager.begin()) {
 *     ExecContext txCtx = executorManager.injectTransaction(ctx, tx);
 *     orders.save(txCtx, order);
 *     tx.commit();
 * }
 * }</pre>
 *
 * @see JdbcTransaction
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ExecutorConfig config;

  public JdbcTransactionManager(ConnectionProvider connectionProvider) {
    this(connectionProvider, new ExecutorConfig());
  }

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ExecutorConfig config) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Begins a new transaction with the connection's default isolation level.
   *
   * @return a new {@link JdbcTransaction} (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained or prepared
   */
  public JdbcTransaction begin() throws SQLException {
    return start(null);
  }

  /**
   * Begins a new transaction at the given isolation level, one of the
   * {@code Connection.TRANSACTION_*} constants. The connection's previous level is restored
   * when the transaction completes.
   */
  public JdbcTransaction begin(int isolationLevel) throws SQLException {
    return start(isolationLevel);
  }

  private JdbcTransaction start(Integer isolationLevel) throws SQLException {
    Connection connection = connectionProvider.getConnection();
    Integer previousIsolation = null;
    try {
      if (isolationLevel != null && connection.getTransactionIsolation() != isolationLevel) {
        previousIsolation = connection.getTransactionIsolation();
        connection.setTransactionIsolation(isolationLevel);
      }
      connection.setAutoCommit(false);
    } catch (SQLException | RuntimeException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    logger.fine("Transaction started");
    return new JdbcTransaction(connection, previousIsolation, config);
  }
}
