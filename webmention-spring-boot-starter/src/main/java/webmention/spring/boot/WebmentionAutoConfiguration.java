package webmention.spring.boot;

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
import org.springframework.context.annotation.Import;
import webmention.Webmentions;
import webmention.WebmentionsConfig;
import webmention.callback.MentionCallback;
import webmention.discovery.EndpointResolver;
import webmention.http.JdkHttpTransport;
import webmention.jdbc.JdbcWebmentionStore;
import webmention.model.Webmention;
import webmention.spi.HttpTransport;
import webmention.spi.MetricsExporter;
import webmention.spi.WebmentionStore;
import webmention.store.InMemoryWebmentionStore;

import javax.sql.DataSource;
import java.util.List;

/**
 * Auto-configuration for webmention processing.
 *
 * <p>Wires a {@link Webmentions} facade from {@link WebmentionProperties}. Mentions are kept
 * in a JDBC table when a {@link DataSource} is present, in memory otherwise. Beans
 * implementing {@link WebmentionListener} receive processed and deleted notifications.
 *
 * @see WebmentionProperties
 * @see WebmentionMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Webmentions.class)
@ConditionalOnProperty(prefix = "webmention", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(WebmentionProperties.class)
@Import({WebmentionAutoConfiguration.JdbcStoreConfiguration.class,
    WebmentionAutoConfiguration.InMemoryStoreConfiguration.class})
public class WebmentionAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(HttpTransport.class)
  public HttpTransport webmentionHttpTransport(WebmentionProperties props) {
    return JdkHttpTransport.create(props.getHttpTimeout(), props.getUserAgent());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Webmentions webmentions(WebmentionProperties props,
      WebmentionStore store,
      HttpTransport transport,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<EndpointResolver> resolverProvider,
      ObjectProvider<WebmentionListener> listenerProvider) {

    List<WebmentionListener> listeners = listenerProvider.orderedStream().toList();
    WebmentionsConfig config = new WebmentionsConfig()
        .setBaseUrl(props.getBaseUrl())
        .setInitialMentionStatus(props.getInitialStatus())
        .setHttpTimeout(props.getHttpTimeout())
        .setUserAgent(props.getUserAgent())
        .setOutgoingConcurrency(props.getOutgoingConcurrency())
        .setNotifyOnRetraction(props.isNotifyOnRetraction())
        .setExcerptLength(props.getExcerptLength());
    if (!listeners.isEmpty()) {
      config.setOnMentionProcessed(fanOut(listeners, true))
          .setOnMentionDeleted(fanOut(listeners, false));
    }

    var builder = Webmentions.builder()
        .store(store)
        .transport(transport)
        .config(config);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    EndpointResolver resolver = resolverProvider.getIfAvailable();
    if (resolver != null) {
      builder.resolver(resolver);
    }
    return builder.build();
  }

  // Every listener runs; failures are rethrown together afterwards for the core to log and count.
  private static MentionCallback fanOut(List<WebmentionListener> listeners, boolean processed) {
    return (Webmention mention) -> {
      Exception failure = null;
      for (WebmentionListener listener : listeners) {
        try {
          if (processed) {
            listener.onMentionProcessed(mention);
          } else {
            listener.onMentionDeleted(mention);
          }
        } catch (Exception e) {
          if (failure == null) {
            failure = e;
          } else {
            failure.addSuppressed(e);
          }
        }
      }
      if (failure != null) {
        throw failure;
      }
    };
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(JdbcWebmentionStore.class)
  @ConditionalOnBean(DataSource.class)
  static class JdbcStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean(WebmentionStore.class)
    public JdbcWebmentionStore webmentionStore(DataSource dataSource, WebmentionProperties props) {
      JdbcWebmentionStore store = JdbcWebmentionStore.create(dataSource, props.getJdbc().getTableName());
      if (props.getJdbc().isInitializeSchema()) {
        store.createSchema();
      }
      return store;
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class InMemoryStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean(WebmentionStore.class)
    public InMemoryWebmentionStore webmentionStore() {
      return new InMemoryWebmentionStore();
    }
  }
}
