package dbexec.spring.boot;

import dbexec.micrometer.MicrometerExecutorMetrics;
import dbexec.spi.ExecutorMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerExecutorMetrics} when Micrometer is on the classpath and
 * {@code dbexec.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link ExecutorAutoConfiguration} so the {@link ExecutorMetrics} bean is
 * picked up by the executor config.
 */
@AutoConfiguration(before = ExecutorAutoConfiguration.class)
@ConditionalOnClass({MicrometerExecutorMetrics.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "dbexec.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(ExecutorProperties.class)
public class ExecutorMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(ExecutorMetrics.class)
  public MicrometerExecutorMetrics micrometerExecutorMetrics(
      MeterRegistry meterRegistry, ExecutorProperties props) {
    return new MicrometerExecutorMetrics(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
