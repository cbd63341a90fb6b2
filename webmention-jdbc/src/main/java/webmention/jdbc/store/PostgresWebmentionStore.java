package webmention.jdbc.store;

import webmention.jdbc.JdbcTemplate;
import webmention.model.Webmention;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL mention store.
 *
 * <p>Upserts with {@code INSERT ... ON CONFLICT (mention_id) DO UPDATE}, leaving
 * {@code created_at} untouched on conflict.
 */
public final class PostgresWebmentionStore extends AbstractJdbcWebmentionStore {

  public PostgresWebmentionStore() {
    super();
  }

  public PostgresWebmentionStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public PostgresWebmentionStore withTableName(String tableName) {
    return new PostgresWebmentionStore(tableName);
  }

  @Override
  public void upsert(Connection conn, Webmention mention) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (" + PLACEHOLDERS + ")" +
        " ON CONFLICT (mention_id) DO UPDATE SET " +
        "status=EXCLUDED.status, mention_type=EXCLUDED.mention_type, rsvp=EXCLUDED.rsvp, " +
        "author_name=EXCLUDED.author_name, author_url=EXCLUDED.author_url, " +
        "author_photo=EXCLUDED.author_photo, title=EXCLUDED.title, excerpt=EXCLUDED.excerpt, " +
        "content=EXCLUDED.content, published=EXCLUDED.published, " +
        "updated_at=EXCLUDED.updated_at, metadata=EXCLUDED.metadata";
    JdbcTemplate.update(conn, sql, rowValues(mention));
  }
}
