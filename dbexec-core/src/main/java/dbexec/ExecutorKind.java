package dbexec;

import java.util.Locale;

/**
 * The three places a statement can be routed to.
 */
public enum ExecutorKind {
  POOL,
  TRANSACTION,
  BATCH;

  /**
   * Lower-case name used as a metric tag value.
   */
  public String tagValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
