package dbexec.spring.boot;

import dbexec.ExecutorConfig;
import dbexec.jdbc.DataSourceConnectionProvider;
import dbexec.jdbc.ExecutorManager;
import dbexec.jdbc.tx.JdbcTransactionManager;
import dbexec.spi.ConnectionProvider;
import dbexec.spi.ExecutorMetrics;
import dbexec.spring.SpringTransactionFactory;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnSingleCandidate;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/**
 * Auto-configuration for the executor resolver.
 *
 * <p>Wires an {@link ExecutorManager} and a {@link JdbcTransactionManager} over the
 * application {@link DataSource}, and a {@link SpringTransactionFactory} when a single
 * {@link PlatformTransactionManager} is available.
 *
 * @see ExecutorProperties
 * @see ExecutorMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {
    DataSourceAutoConfiguration.class,
    DataSourceTransactionManagerAutoConfiguration.class})
@ConditionalOnClass(ExecutorManager.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(ExecutorProperties.class)
public class ExecutorAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public ExecutorConfig executorConfig(ExecutorProperties props,
      ObjectProvider<ExecutorMetrics> metricsProvider) {
    ExecutorConfig config = new ExecutorConfig()
        .setCopyChunkSize(props.getCopyChunkSize())
        .setQueryTimeout(props.getQueryTimeout());
    ExecutorMetrics metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      config.setMetrics(metrics);
    }
    return config;
  }

  @Bean
  @ConditionalOnMissingBean
  public ExecutorManager executorManager(ConnectionProvider connectionProvider, ExecutorConfig config) {
    return new ExecutorManager(connectionProvider, config);
  }

  @Bean
  @ConditionalOnMissingBean
  public JdbcTransactionManager jdbcTransactionManager(ConnectionProvider connectionProvider,
      ExecutorConfig config) {
    return new JdbcTransactionManager(connectionProvider, config);
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnSingleCandidate(PlatformTransactionManager.class)
  public SpringTransactionFactory springTransactionFactory(PlatformTransactionManager transactionManager,
      DataSource dataSource, ExecutorConfig config) {
    return new SpringTransactionFactory(transactionManager, dataSource, config);
  }
}
