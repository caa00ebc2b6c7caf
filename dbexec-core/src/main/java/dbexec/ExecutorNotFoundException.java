package dbexec;

import java.sql.SQLException;

/**
 * Reported by the resolver's {@code getTransactionExecutor} and {@code getBatchExecutor}
 * accessors. Carries the executor that the lookup produced, if any.
 */
public final class ExecutorNotFoundException extends SQLException {
  private final transient Executor executor;

  public ExecutorNotFoundException(String message, Executor executor) {
    super(message);
    this.executor = executor;
  }

  /**
   * The executor found in the context when this exception was raised, or {@code null}.
   */
  public Executor getExecutor() {
    return executor;
  }
}
