package webmention.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC mention stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/webmention.jdbc.store.AbstractJdbcWebmentionStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcWebmentionStore store = JdbcWebmentionStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcWebmentionStore store = JdbcWebmentionStores.detect("jdbc:postgresql://localhost/site");
 *
 * // Get by name
 * AbstractJdbcWebmentionStore store = JdbcWebmentionStores.get("mysql");
 * }</pre>
 */
public final class JdbcWebmentionStores {

  private static final List<AbstractJdbcWebmentionStore> STORES;
  private static final Map<String, AbstractJdbcWebmentionStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcWebmentionStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcWebmentionStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcWebmentionStores() {
  }

  /**
   * Returns all registered stores.
   */
  public static List<AbstractJdbcWebmentionStore> all() {
    return STORES;
  }

  /**
   * Gets a store by name.
   *
   * @param name store name (case-insensitive)
   * @return the store
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcWebmentionStore get(String name) {
    AbstractJdbcWebmentionStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown mention store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the store from a DataSource.
   *
   * @param dataSource the data source
   * @return detected store
   * @throws IllegalStateException if the connection metadata cannot be read
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcWebmentionStore detect(DataSource dataSource) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect mention store from DataSource", e);
    }
    return detect(url);
  }

  /**
   * Auto-detects the store from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected store
   * @throws IllegalArgumentException if no matching store found
   */
  public static AbstractJdbcWebmentionStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcWebmentionStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No mention store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
