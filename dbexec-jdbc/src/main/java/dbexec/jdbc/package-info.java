/**
 * JDBC side of the executor API: the {@link dbexec.jdbc.ExecutorManager} resolver and the
 * {@link dbexec.jdbc.PoolExecutor} it falls back to.
 *
 * <p>{@link dbexec.jdbc.AbstractConnectionExecutor} implements every {@link dbexec.Executor}
 * operation on a borrowed connection; the pool and {@link dbexec.jdbc.tx.JdbcTransaction}
 * differ only in where that connection comes from. Bulk copy is portable: chunked
 * {@code INSERT} batches rather than a vendor {@code COPY} protocol.
 *
 * @see dbexec.jdbc.ExecutorManager
 * @see dbexec.jdbc.PoolExecutor
 * @see dbexec.jdbc.DataSourceConnectionProvider
 */
package dbexec.jdbc;
