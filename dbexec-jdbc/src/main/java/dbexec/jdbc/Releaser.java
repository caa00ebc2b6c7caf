package dbexec.jdbc;

import java.sql.SQLException;

/**
 * Hands a borrowed connection back once the resource built on it is closed.
 */
@FunctionalInterface
interface Releaser {
  Releaser NONE = () -> {
  };

  void release() throws SQLException;
}
