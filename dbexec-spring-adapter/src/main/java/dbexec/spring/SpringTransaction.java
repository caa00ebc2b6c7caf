package dbexec.spring;

import dbexec.ExecutorConfig;
import dbexec.ExecutorKind;
import dbexec.Transaction;
import dbexec.jdbc.AbstractConnectionExecutor;

import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link Transaction} driven by Spring's {@link PlatformTransactionManager}.
 *
 * <p>Statements run on the connection Spring binds to the current thread, obtained through
 * {@link DataSourceUtils}, so they share the transaction with {@code JdbcTemplate} and
 * {@code @Transactional} code on the same thread. Commit and rollback go through the
 * transaction manager. Like every Spring-managed transaction this one is thread-bound: use
 * it only on the thread that began it.
 *
 * @see SpringTransactionFactory
 */
public final class SpringTransaction extends AbstractConnectionExecutor implements Transaction {
  private final PlatformTransactionManager transactionManager;
  private final DataSource dataSource;
  private final TransactionStatus status;

  private SpringTransaction(PlatformTransactionManager transactionManager, DataSource dataSource,
      TransactionStatus status, ExecutorConfig config) {
    super(config);
    this.transactionManager = transactionManager;
    this.dataSource = dataSource;
    this.status = status;
  }

  /**
   * Begins (or joins, depending on the definition's propagation) a Spring transaction.
   */
  public static SpringTransaction begin(PlatformTransactionManager transactionManager,
      DataSource dataSource, TransactionDefinition definition, ExecutorConfig config) {
    Objects.requireNonNull(transactionManager, "transactionManager");
    Objects.requireNonNull(dataSource, "dataSource");
    Objects.requireNonNull(definition, "definition");
    Objects.requireNonNull(config, "config");
    TransactionStatus status = transactionManager.getTransaction(definition);
    return new SpringTransaction(transactionManager, dataSource, status, config);
  }

  public static SpringTransaction begin(PlatformTransactionManager transactionManager,
      DataSource dataSource) {
    return begin(transactionManager, dataSource, TransactionDefinition.withDefaults(),
        new ExecutorConfig());
  }

  /**
   * The underlying Spring status, e.g. for {@code setRollbackOnly()}.
   */
  public TransactionStatus status() {
    return status;
  }

  @Override
  protected Connection acquire() throws SQLException {
    if (status.isCompleted()) {
      throw new SQLException("transaction already completed");
    }
    return DataSourceUtils.doGetConnection(dataSource);
  }

  @Override
  protected void release(Connection connection) throws SQLException {
    DataSourceUtils.doReleaseConnection(connection, dataSource);
  }

  @Override
  public ExecutorKind kind() {
    return ExecutorKind.TRANSACTION;
  }

  @Override
  public boolean isActive() {
    return !status.isCompleted();
  }

  /**
   * Commits through the transaction manager. Spring rolls back instead when the status was
   * marked rollback-only. Failures surface as Spring's unchecked
   * {@code TransactionException}.
   */
  @Override
  public void commit() {
    if (!status.isCompleted()) {
      transactionManager.commit(status);
    }
  }

  @Override
  public void rollback() {
    if (!status.isCompleted()) {
      transactionManager.rollback(status);
    }
  }

  @Override
  public void close() {
    rollback();
  }
}
