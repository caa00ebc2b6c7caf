package dbexec.spi;

import dbexec.ExecutorKind;
import dbexec.Operation;

/**
 * Observability hook for executor activity.
 *
 * <p>The {@link #NOOP} instance discards everything. Implementations must be thread-safe and
 * must not throw.
 */
public interface ExecutorMetrics {

  /**
   * No-op instance that discards all metrics.
   */
  ExecutorMetrics NOOP = new Noop();

  /**
   * Counts one resolution of an executor for a context.
   */
  void incrementResolved(ExecutorKind kind);

  /**
   * Records one statement execution.
   *
   * @param durationNanos time until the statement returned (for queries, until the cursor was
   *                      opened)
   * @param failed        whether the driver reported an error
   */
  void recordStatement(ExecutorKind kind, Operation operation, long durationNanos, boolean failed);

  /**
   * Counts rows loaded by {@code copyFrom}.
   */
  default void incrementRowsCopied(ExecutorKind kind, long rows) {
  }

  /**
   * Counts statements submitted through {@code sendBatch}.
   */
  default void incrementBatchStatements(ExecutorKind kind, int statements) {
  }

  final class Noop implements ExecutorMetrics {
    @Override
    public void incrementResolved(ExecutorKind kind) {
    }

    @Override
    public void recordStatement(ExecutorKind kind, Operation operation, long durationNanos, boolean failed) {
    }
  }
}
