package dbexec;

import java.sql.SQLException;

/**
 * Outcomes of a sent {@link Batch}, read back one per queued statement in queue order.
 *
 * <p>Each read consumes the next statement. {@link #close()} processes every statement not
 * read yet (invoking the callbacks registered on its {@link QueuedStatement}) and must always
 * be called:
 * <pre>{@code
 * try (BatchResults results = executor.sendBatch(ctx, batch)) {
 *     CommandTag inserted = results.exec();
 *     long total = results.queryRow().scalar(Long.class);
 * }
 * }</pre>
 */
public interface BatchResults extends AutoCloseable {

  /**
   * Reads the outcome of the next statement as a command tag.
   *
   * @throws SQLException if that statement failed or the batch has no more statements
   */
  CommandTag exec() throws SQLException;

  /**
   * Reads the rows of the next statement. The rows are closed when the next statement is
   * read, if not before.
   */
  Rows query() throws SQLException;

  /**
   * Reads the next statement as a single row; failures are deferred to
   * {@link Row#scan(RowMapper)}.
   */
  Row queryRow();

  /**
   * Finishes the batch and releases its resources.
   *
   * @throws SQLException the first failure seen while the batch was processed
   */
  @Override
  void close() throws SQLException;
}
