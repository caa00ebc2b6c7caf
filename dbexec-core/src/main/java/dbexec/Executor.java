package dbexec;

import java.sql.SQLException;
import java.util.List;

/**
 * Something that can run SQL: the shared pool, an open {@link Transaction}, or a queued
 * {@link BatchExecutor}.
 *
 * <p>Code that only needs to run statements should depend on this interface and obtain the
 * instance from the executor resolver, so the same repository method works inside and
 * outside a transaction or batch.
 *
 * <p>Errors raised by the driver are thrown as-is; implementations do not wrap, retry or
 * classify them.
 */
public interface Executor {

  /**
   * Runs a statement that does not return rows (or whose rows are ignored).
   *
   * @param ctx  request context; its timeout, if any, applies to the statement
   * @param sql  statement text with {@code ?} placeholders
   * @param args positional arguments
   * @return the command-completion tag
   * @throws SQLException if the statement fails
   */
  CommandTag exec(ExecContext ctx, String sql, Object... args) throws SQLException;

  /**
   * Runs a query. The returned rows are forward-only and read lazily; they must be closed
   * (exhausting them with {@link Rows#next()} also closes them).
   *
   * @throws SQLException if the query cannot be executed
   */
  Rows query(ExecContext ctx, String sql, Object... args) throws SQLException;

  /**
   * Runs a query expected to return at most one row. Never throws; failures, including an
   * empty result, surface from {@link Row#scan(RowMapper)}.
   */
  Row queryRow(ExecContext ctx, String sql, Object... args);

  /**
   * Submits every statement queued in {@code batch}. Results are read back in queue order
   * from the returned handle, which must be closed.
   */
  BatchResults sendBatch(ExecContext ctx, Batch batch);

  /**
   * Bulk-loads rows into {@code table}.
   *
   * @param table   target table
   * @param columns column names, in the order of the values produced by {@code source}
   * @param source  row source
   * @return number of rows copied
   * @throws SQLException if any row fails; no rows are kept unless the caller's transaction
   *                      decides otherwise
   */
  long copyFrom(ExecContext ctx, Identifier table, List<String> columns, CopyFromSource source)
      throws SQLException;
}
