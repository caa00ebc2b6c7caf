/**
 * Root API: a single {@link dbexec.Executor} capability satisfied by the shared pool, an open
 * {@link dbexec.Transaction} and a queued {@link dbexec.BatchExecutor}, plus the immutable
 * {@link dbexec.ExecContext} that carries the transaction or batch down the call chain.
 *
 * <h2>Core Design</h2>
 * <p>Repository code asks the resolver for "the executor for this context" and runs its SQL
 * there. The resolver prefers a batch injected into the context, then a transaction, and
 * falls back to the pool. The same repository method therefore joins an enclosing
 * transaction or batch without changing its signature.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>dbexec-core</b>: capability API, context, batch queue (zero external deps)</li>
 *   <li><b>dbexec-jdbc</b>: resolver, pool executor, JDBC transactions</li>
 *   <li><b>dbexec-spring-adapter</b>: transactions driven by Spring's transaction manager</li>
 *   <li><b>dbexec-micrometer</b>: metrics bridge</li>
 *   <li><b>dbexec-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var pool      = new DataSourceConnectionProvider(dataSource);
 * var manager   = new ExecutorManager(pool);
 * var txManager = new JdbcTransactionManager(pool);
 *
 * ExecContext ctx = ExecContext.background();
 * try (JdbcTransaction tx = txManager.begin()) {
 *     ExecContext txCtx = manager.injectTransaction(ctx, tx);
 *     manager.getExecutor(txCtx).exec(txCtx, "UPDATE account SET balance = balance - ? WHERE id = ?", 10, 1);
 *     manager.getExecutor(txCtx).exec(txCtx, "UPDATE account SET balance = balance + ? WHERE id = ?", 10, 2);
 *     tx.commit();
 * }
 * }</pre>
 *
 * @see dbexec.Executor
 * @see dbexec.ExecContext
 * @see dbexec.BatchExecutor
 * @see dbexec.Transaction
 */
package dbexec;
