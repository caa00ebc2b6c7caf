package dbexec.jdbc;

import dbexec.ExecutorConfig;
import dbexec.ExecutorKind;
import dbexec.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Executor over the shared connection pool: each operation borrows a connection and returns
 * it when the operation, or the cursor/row/batch results it produced, is closed.
 *
 * <p>Statements run in the pool connection's auto-commit mode. {@code sendBatch} and
 * {@code copyFrom} wrap their statements in a transaction of their own so they apply
 * atomically.
 *
 * <p>Instances are cheap and stateless; two pool executors over the same pool and config are
 * equal.
 */
public final class PoolExecutor extends AbstractConnectionExecutor {
  private final ConnectionProvider pool;

  public PoolExecutor(ConnectionProvider pool) {
    this(pool, new ExecutorConfig());
  }

  public PoolExecutor(ConnectionProvider pool, ExecutorConfig config) {
    super(config);
    this.pool = Objects.requireNonNull(pool, "pool");
  }

  public ConnectionProvider pool() {
    return pool;
  }

  @Override
  protected Connection acquire() throws SQLException {
    return pool.getConnection();
  }

  @Override
  protected void release(Connection connection) throws SQLException {
    connection.close();
  }

  @Override
  public ExecutorKind kind() {
    return ExecutorKind.POOL;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PoolExecutor other)) {
      return false;
    }
    return pool == other.pool && config == other.config;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(pool) * 31 + System.identityHashCode(config);
  }

  @Override
  public String toString() {
    return "PoolExecutor[" + pool + "]";
  }
}
