package webmention.jdbc.store;

import webmention.jdbc.JdbcTemplate;
import webmention.model.Webmention;

import java.sql.Connection;
import java.util.List;

/**
 * H2 mention store. Primarily for testing and embedded deployments.
 *
 * <p>Upserts with {@code MERGE INTO ... KEY (mention_id)}; {@code created_at} is written from
 * the mention, which callers keep equal to the stored value on update.
 */
public final class H2WebmentionStore extends AbstractJdbcWebmentionStore {

  public H2WebmentionStore() {
    super();
  }

  public H2WebmentionStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public H2WebmentionStore withTableName(String tableName) {
    return new H2WebmentionStore(tableName);
  }

  @Override
  public void upsert(Connection conn, Webmention mention) {
    String sql = "MERGE INTO " + tableName() + " (" + COLUMNS + ") KEY (mention_id) VALUES (" +
        PLACEHOLDERS + ")";
    JdbcTemplate.update(conn, sql, rowValues(mention));
  }
}
