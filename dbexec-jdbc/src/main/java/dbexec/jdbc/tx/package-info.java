/**
 * Manual JDBC transaction management.
 *
 * <p>{@link dbexec.jdbc.tx.JdbcTransactionManager} begins transactions;
 * {@link dbexec.jdbc.tx.JdbcTransaction} is both the transaction handle and an
 * {@link dbexec.Executor} that can be injected into an {@link dbexec.ExecContext}.
 *
 * @see dbexec.jdbc.tx.JdbcTransactionManager
 * @see dbexec.jdbc.tx.JdbcTransaction
 */
package dbexec.jdbc.tx;
