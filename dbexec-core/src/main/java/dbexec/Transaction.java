package dbexec;

import java.sql.SQLException;

/**
 * An open database transaction that can also act as an {@link Executor}.
 *
 * <p>Transactions are created and finished by the code that owns the unit of work. The
 * executor resolver only carries them through an {@link ExecContext}; it never commits or
 * rolls back. Use with try-with-resources so an unfinished transaction is rolled back:
 * <pre>{@code
 * try (Transaction tx = txManager.begin()) {
 *     ExecContext ctx = manager.injectTransaction(parent, tx);
 *     orders.save(ctx, order);
 *     tx.commit();
 * }
 * }</pre>
 */
public interface Transaction extends Executor, AutoCloseable {

  void commit() throws SQLException;

  void rollback() throws SQLException;

  /**
   * Returns {@code true} until the transaction has been committed or rolled back.
   */
  boolean isActive();

  /**
   * Rolls back if the transaction is still active; otherwise does nothing.
   */
  @Override
  void close() throws SQLException;
}
