package webmention.jdbc;

import webmention.jdbc.store.AbstractJdbcWebmentionStore;
import webmention.jdbc.store.JdbcWebmentionStores;
import webmention.model.Webmention;
import webmention.model.WebmentionDirection;
import webmention.spi.WebmentionStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link WebmentionStore} running each call in its own JDBC transaction.
 *
 * <p>Statements come from an {@link AbstractJdbcWebmentionStore}; connections from a
 * {@link ConnectionProvider}. {@link #store} reads the existing row first so an update keeps
 * the stored {@code createdAt}.
 *
 * <pre>{@code
 * JdbcWebmentionStore store = JdbcWebmentionStore.create(dataSource);
 * store.createSchema();
 * }</pre>
 */
public final class JdbcWebmentionStore implements WebmentionStore {
  private static final Logger logger = Logger.getLogger(JdbcWebmentionStore.class.getName());

  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcWebmentionStore statements;

  public JdbcWebmentionStore(ConnectionProvider connectionProvider,
      AbstractJdbcWebmentionStore statements) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.statements = Objects.requireNonNull(statements, "statements");
  }

  /**
   * Detects the database behind {@code dataSource} and uses the default table.
   */
  public static JdbcWebmentionStore create(DataSource dataSource) {
    return create(dataSource, TableNames.DEFAULT_TABLE);
  }

  public static JdbcWebmentionStore create(DataSource dataSource, String tableName) {
    AbstractJdbcWebmentionStore detected = JdbcWebmentionStores.detect(dataSource);
    return new JdbcWebmentionStore(new DataSourceConnectionProvider(dataSource),
        detected.withTableName(tableName));
  }

  public AbstractJdbcWebmentionStore statements() {
    return statements;
  }

  /**
   * Creates the mention table if it is missing.
   */
  public void createSchema() {
    inTransaction(conn -> {
      statements.createSchema(conn);
      return null;
    });
    logger.log(Level.INFO, "Mention table {0} ready ({1})",
        new Object[]{statements.tableName(), statements.name()});
  }

  @Override
  public void store(Webmention mention) {
    Objects.requireNonNull(mention, "mention");
    inTransaction(conn -> {
      Webmention toWrite = statements
          .find(conn, mention.source(), mention.target(), mention.direction())
          .map(existing -> keepCreatedAt(existing, mention))
          .orElse(mention);
      statements.upsert(conn, toWrite);
      return null;
    });
  }

  @Override
  public boolean delete(String source, String target, WebmentionDirection direction) {
    return inTransaction(conn ->
        statements.markDeleted(conn, source, target, direction, Instant.now()) > 0);
  }

  @Override
  public List<Webmention> retrieve(String resource, WebmentionDirection direction) {
    return inTransaction(conn -> statements.retrieve(conn, resource, direction));
  }

  @Override
  public Optional<Webmention> find(String source, String target, WebmentionDirection direction) {
    return inTransaction(conn -> statements.find(conn, source, target, direction));
  }

  private static Webmention keepCreatedAt(Webmention existing, Webmention incoming) {
    if (existing.createdAt().equals(incoming.createdAt())) {
      return incoming;
    }
    Instant updatedAt = incoming.updatedAt().isBefore(existing.createdAt())
        ? existing.createdAt() : incoming.updatedAt();
    return incoming.toBuilder().createdAt(existing.createdAt()).updatedAt(updatedAt).build();
  }

  private <T> T inTransaction(Function<Connection, T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        T result = work.apply(conn);
        conn.commit();
        return result;
      } catch (RuntimeException e) {
        rollback(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw new WebmentionStoreException("Failed to run mention store transaction", e);
    }
  }

  private static void rollback(Connection conn, RuntimeException cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }
}
