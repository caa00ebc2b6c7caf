package dbexec;

import dbexec.spi.ExecutorMetrics;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings shared by the JDBC executors.
 */
public final class ExecutorConfig {
  public static final int DEFAULT_COPY_CHUNK_SIZE = 1000;

  private int copyChunkSize = DEFAULT_COPY_CHUNK_SIZE;
  private Duration queryTimeout = Duration.ZERO;
  private ExecutorMetrics metrics = ExecutorMetrics.NOOP;

  public int getCopyChunkSize() {
    return copyChunkSize;
  }

  /**
   * Rows sent per JDBC batch by {@code copyFrom}.
   */
  public ExecutorConfig setCopyChunkSize(int copyChunkSize) {
    if (copyChunkSize <= 0) {
      throw new IllegalArgumentException("copyChunkSize must be > 0: " + copyChunkSize);
    }
    this.copyChunkSize = copyChunkSize;
    return this;
  }

  public Duration getQueryTimeout() {
    return queryTimeout;
  }

  /**
   * Timeout for statements whose context carries none. {@link Duration#ZERO} means no limit.
   */
  public ExecutorConfig setQueryTimeout(Duration queryTimeout) {
    Objects.requireNonNull(queryTimeout, "queryTimeout");
    if (queryTimeout.isNegative()) {
      throw new IllegalArgumentException("queryTimeout must be >= 0: " + queryTimeout);
    }
    this.queryTimeout = queryTimeout;
    return this;
  }

  public ExecutorMetrics getMetrics() {
    return metrics;
  }

  public ExecutorConfig setMetrics(ExecutorMetrics metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    return this;
  }

  /**
   * Timeout to apply for {@code ctx}: the context's own, else the configured default.
   */
  public Duration effectiveTimeout(ExecContext ctx) {
    Objects.requireNonNull(ctx, "ctx");
    return ctx.timeout().orElse(queryTimeout);
  }
}
