/**
 * Service Provider Interfaces for plugging the executors into a connection pool and a
 * metrics backend.
 *
 * @see dbexec.spi.ConnectionProvider
 * @see dbexec.spi.ExecutorMetrics
 */
package dbexec.spi;
