package dbexec;

import java.util.Locale;

/**
 * {@link Executor} operations, as reported to {@link dbexec.spi.ExecutorMetrics}.
 */
public enum Operation {
  EXEC,
  QUERY,
  QUERY_ROW,
  SEND_BATCH,
  COPY_FROM;

  public String tagValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
