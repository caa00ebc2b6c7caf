package dbexec.spring.boot;

import dbexec.ExecutorConfig;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the executor resolver.
 *
 * @see ExecutorAutoConfiguration
 */
@ConfigurationProperties(prefix = "dbexec")
public class ExecutorProperties {

  /**
   * Rows per JDBC batch when copying.
   */
  private int copyChunkSize = ExecutorConfig.DEFAULT_COPY_CHUNK_SIZE;

  /**
   * Default statement timeout; zero means none.
   */
  private Duration queryTimeout = Duration.ZERO;

  private final Metrics metrics = new Metrics();

  public int getCopyChunkSize() {
    return copyChunkSize;
  }

  public void setCopyChunkSize(int copyChunkSize) {
    this.copyChunkSize = copyChunkSize;
  }

  public Duration getQueryTimeout() {
    return queryTimeout;
  }

  public void setQueryTimeout(Duration queryTimeout) {
    this.queryTimeout = queryTimeout;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "dbexec";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
