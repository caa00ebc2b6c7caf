package dbexec.spring;

import dbexec.ExecutorConfig;

import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * Begins {@link SpringTransaction}s against one data source and transaction manager.
 *
 * <pre>{@code
 * try (SpringTransaction tx = transactions.begin()) {
 *     ExecContext txCtx = executorManager.injectTransaction(ctx, tx);
 *     orders.save(txCtx, order);
 *     tx.commit();
 * }
 * }</pre>
 */
public final class SpringTransactionFactory {
  private final PlatformTransactionManager transactionManager;
  private final DataSource dataSource;
  private final ExecutorConfig config;

  public SpringTransactionFactory(PlatformTransactionManager transactionManager, DataSource dataSource) {
    this(transactionManager, dataSource, new ExecutorConfig());
  }

  public SpringTransactionFactory(PlatformTransactionManager transactionManager, DataSource dataSource,
      ExecutorConfig config) {
    this.transactionManager = Objects.requireNonNull(transactionManager, "transactionManager");
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.config = Objects.requireNonNull(config, "config");
  }

  public SpringTransaction begin() {
    return begin(TransactionDefinition.withDefaults());
  }

  public SpringTransaction begin(TransactionDefinition definition) {
    return SpringTransaction.begin(transactionManager, dataSource, definition, config);
  }
}
