package courier.spring.boot;

import courier.ClientEventListener;
import courier.Courier;
import courier.DeliveryFailureListener;
import courier.dispatch.ExponentialBackoffRetryPolicy;
import courier.jdbc.ConnectionProvider;
import courier.jdbc.JdbcSideStore;
import courier.jdbc.SideStorePurgeScheduler;
import courier.queue.InMemorySideStore;
import courier.spi.MetricsExporter;
import courier.spi.SideStore;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for the delivery layer.
 *
 * <p>Wires a {@link Courier} from {@link CourierProperties}. The side store is a
 * {@link JdbcSideStore} over the application's {@link DataSource} when one exists and
 * {@code courier.side-store.type} is {@code jdbc} (the default), otherwise an
 * {@link InMemorySideStore}. Every {@link DeliveryFailureListener} and
 * {@link ClientEventListener} bean in the context receives callbacks.
 *
 * @see CourierProperties
 * @see CourierMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Courier.class)
@EnableConfigurationProperties(CourierProperties.class)
public class CourierAutoConfiguration {
  private static final Logger logger = Logger.getLogger(CourierAutoConfiguration.class.getName());

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(JdbcSideStore.class)
  @ConditionalOnBean(DataSource.class)
  @ConditionalOnProperty(prefix = "courier.side-store", name = "type", havingValue = "jdbc", matchIfMissing = true)
  static class JdbcSideStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public ConnectionProvider courierConnectionProvider(DataSource dataSource) {
      return dataSource::getConnection;
    }

    @Bean
    @ConditionalOnMissingBean(SideStore.class)
    public JdbcSideStore jdbcSideStore(ConnectionProvider connectionProvider, CourierProperties props) {
      return new JdbcSideStore(connectionProvider, props.getSideStore().getTableName());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnBean(JdbcSideStore.class)
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "courier.side-store", name = "purge-enabled", matchIfMissing = true)
    public SideStorePurgeScheduler sideStorePurgeScheduler(JdbcSideStore sideStore, CourierProperties props) {
      SideStorePurgeScheduler scheduler = SideStorePurgeScheduler.builder()
          .sideStore(sideStore)
          .interval(props.getSideStore().getPurgeInterval())
          .build();
      scheduler.start();
      return scheduler;
    }
  }

  @Bean
  @ConditionalOnMissingBean(SideStore.class)
  public InMemorySideStore inMemorySideStore() {
    return new InMemorySideStore();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Courier courier(CourierProperties props,
      SideStore sideStore,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<DeliveryFailureListener> failureListeners,
      ObjectProvider<ClientEventListener> clientEventListeners) {

    CourierProperties.Retry retry = props.getRetry();
    var builder = Courier.builder()
        .sideStore(sideStore)
        .retryPolicy(new ExponentialBackoffRetryPolicy(retry.getBaseDelay().toMillis(),
            retry.getMultiplier(), retry.getMaxDelay().toMillis(), retry.getJitter()))
        .ackTimeout(props.getAckTimeout())
        .defaultTtl(props.getDefaultTtl())
        .defaultMaxRetries(props.getMaxRetries())
        .defaultRequiresAck(props.isRequiresAck())
        .queueCapacity(props.getQueueCapacity())
        .batchSize(props.getBatch().getSize())
        .batchWindow(props.getBatch().getWindow())
        .maxConnectionsPerPrincipal(props.getMaxConnectionsPerPrincipal())
        .keyPrefix(props.getSideStore().getKeyPrefix())
        .keyTtl(props.getSideStore().getKeyTtl())
        .probeInterval(props.getLiveness().getProbeInterval())
        .missedProbeThreshold(props.getLiveness().getMissedProbeThreshold())
        .sweepInterval(props.getSweepInterval())
        .timerThreads(props.getTimerThreads())
        .failureListener(failureListener(failureListeners.orderedStream().toList()))
        .clientEventListener(clientEventListener(clientEventListeners.orderedStream().toList()));
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  private static DeliveryFailureListener failureListener(List<DeliveryFailureListener> listeners) {
    if (listeners.isEmpty()) {
      return DeliveryFailureListener.NOOP;
    }
    if (listeners.size() == 1) {
      return listeners.get(0);
    }
    return (envelope, reason) -> {
      for (DeliveryFailureListener listener : listeners) {
        try {
          listener.deliveryFailed(envelope, reason);
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "DeliveryFailureListener threw for " + envelope.envelopeId(), e);
        }
      }
    };
  }

  private static ClientEventListener clientEventListener(List<ClientEventListener> listeners) {
    if (listeners.isEmpty()) {
      return ClientEventListener.NOOP;
    }
    if (listeners.size() == 1) {
      return listeners.get(0);
    }
    return (connectionId, principalId, event, payload) -> {
      for (ClientEventListener listener : listeners) {
        try {
          listener.eventReceived(connectionId, principalId, event, payload);
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "ClientEventListener threw for " + event, e);
        }
      }
    };
  }
}
