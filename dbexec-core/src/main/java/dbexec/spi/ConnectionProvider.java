package dbexec.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * The shared connection pool behind the pool executor.
 *
 * <p>Callers are responsible for closing the returned connection, which hands it back to the
 * pool. Pool sizing, health checks and reuse are the provider's business.
 *
 * @see dbexec.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

  /**
   * Obtains a connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
