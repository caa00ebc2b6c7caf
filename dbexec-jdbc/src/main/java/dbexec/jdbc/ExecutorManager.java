package dbexec.jdbc;

import dbexec.BatchExecutor;
import dbexec.ExecContext;
import dbexec.Executor;
import dbexec.ExecutorConfig;
import dbexec.ExecutorKind;
import dbexec.ExecutorNotFoundException;
import dbexec.Transaction;
import dbexec.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves which {@link Executor} should run the next statement for a request.
 *
 * <p>A transaction or batch is made visible to downstream code by injecting it into the
 * {@link ExecContext}; {@link #getExecutor(ExecContext)} then picks, in fixed priority:
 * <ol>
 *   <li>the injected {@link BatchExecutor}, so statements are queued rather than run;</li>
 *   <li>the injected {@link Transaction};</li>
 *   <li>a {@link PoolExecutor} over the shared pool.</li>
 * </ol>
 *
 * <p>Resolution is a fresh lookup on every call; nothing is cached. The manager never
 * creates, commits or rolls back a transaction, and never sends a batch: that is the job of
 * whoever injected it.
 *
 * <pre>{@code
 * ExecutorManager manager = new ExecutorManager(dataSource);
 *
 * void save(ExecContext ctx, Order order) throws SQLException {
 *     manager.getExecutor(ctx).exec(ctx, "INSERT INTO orders (id, total) VALUES (?, ?)",
 *         order.id(), order.total());
 * }
 * }</pre>
 */
public final class ExecutorManager {
  private static final ExecContext.Key<Transaction> TX_KEY =
      ExecContext.Key.of("dbexec.transaction", Transaction.class);
  private static final ExecContext.Key<BatchExecutor> BATCH_KEY =
      ExecContext.Key.of("dbexec.batch", BatchExecutor.class);

  private final ConnectionProvider pool;
  private final ExecutorConfig config;

  public ExecutorManager(ConnectionProvider pool) {
    this(pool, new ExecutorConfig());
  }

  public ExecutorManager(DataSource dataSource) {
    this(new DataSourceConnectionProvider(dataSource));
  }

  public ExecutorManager(ConnectionProvider pool, ExecutorConfig config) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Returns a child of {@code ctx} carrying {@code tx}. An enclosing transaction is shadowed,
   * not merged.
   */
  public ExecContext injectTransaction(ExecContext ctx, Transaction tx) {
    Objects.requireNonNull(ctx, "ctx");
    return ctx.with(TX_KEY, tx);
  }

  /**
   * Returns the transaction visible from {@code ctx}, if any.
   */
  public Optional<Transaction> extractTransaction(ExecContext ctx) {
    Objects.requireNonNull(ctx, "ctx");
    return ctx.get(TX_KEY);
  }

  /**
   * Creates an empty batch. It is not visible to anyone until injected.
   */
  public BatchExecutor newBatch() {
    return new BatchExecutor();
  }

  /**
   * Returns a child of {@code ctx} carrying {@code batch}.
   */
  public ExecContext injectBatch(ExecContext ctx, BatchExecutor batch) {
    Objects.requireNonNull(ctx, "ctx");
    return ctx.with(BATCH_KEY, batch);
  }

  /**
   * Returns the batch visible from {@code ctx}, if any.
   */
  public Optional<BatchExecutor> extractBatch(ExecContext ctx) {
    Objects.requireNonNull(ctx, "ctx");
    return ctx.get(BATCH_KEY);
  }

  /**
   * Returns the batch in {@code ctx}, else the transaction in {@code ctx}, else a pool
   * executor.
   */
  public Executor getExecutor(ExecContext ctx) {
    Optional<BatchExecutor> batch = extractBatch(ctx);
    if (batch.isPresent()) {
      config.getMetrics().incrementResolved(ExecutorKind.BATCH);
      return batch.get();
    }
    Optional<Transaction> tx = extractTransaction(ctx);
    if (tx.isPresent()) {
      config.getMetrics().incrementResolved(ExecutorKind.TRANSACTION);
      return tx.get();
    }
    config.getMetrics().incrementResolved(ExecutorKind.POOL);
    return new PoolExecutor(pool, config);
  }

  /**
   * Returns a pool executor regardless of what the context holds. Statements run outside any
   * injected transaction or batch; prefer {@link #getExecutor(ExecContext)}.
   */
  public Executor getPoolExecutor() {
    return new PoolExecutor(pool, config);
  }

  /**
   * Legacy accessor for the transaction slot. Prefer {@link #getExecutor(ExecContext)} or
   * {@link #extractTransaction(ExecContext)}.
   *
   * <p><b>The outcome is inverted:</b> when {@code ctx} carries no transaction this returns
   * {@code null} without error; when it does carry one, this throws an
   * {@link ExecutorNotFoundException} whose {@link ExecutorNotFoundException#getExecutor()}
   * is the transaction that was found. Existing callers depend on this behavior.
   *
   * @return {@code null} when no transaction is present
   * @throws ExecutorNotFoundException when a transaction is present
   */
  public Executor getTransactionExecutor(ExecContext ctx) throws ExecutorNotFoundException {
    Optional<Transaction> tx = extractTransaction(ctx);
    if (tx.isEmpty()) {
      return null;
    }
    throw new ExecutorNotFoundException("no transaction found in context", tx.get());
  }

  /**
   * Legacy accessor for the batch slot, with the same inverted outcome as
   * {@link #getTransactionExecutor(ExecContext)}: {@code null} when no batch is present, an
   * {@link ExecutorNotFoundException} carrying the batch when one is.
   *
   * @return {@code null} when no batch is present
   * @throws ExecutorNotFoundException when a batch is present
   */
  public Executor getBatchExecutor(ExecContext ctx) throws ExecutorNotFoundException {
    Optional<BatchExecutor> batch = extractBatch(ctx);
    if (batch.isEmpty()) {
      return null;
    }
    throw new ExecutorNotFoundException("no batch found in context", batch.get());
  }

  public ConnectionProvider pool() {
    return pool;
  }

  public ExecutorConfig config() {
    return config;
  }
}
