package webmention.jdbc.store;

import webmention.jdbc.JdbcTemplate;
import webmention.model.Webmention;

import java.sql.Connection;
import java.util.List;

/**
 * MySQL/MariaDB mention store.
 *
 * <p>Upserts with {@code INSERT ... ON DUPLICATE KEY UPDATE}, leaving {@code created_at}
 * untouched on duplicates.
 */
public final class MySqlWebmentionStore extends AbstractJdbcWebmentionStore {

  public MySqlWebmentionStore() {
    super();
  }

  public MySqlWebmentionStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  public MySqlWebmentionStore withTableName(String tableName) {
    return new MySqlWebmentionStore(tableName);
  }

  @Override
  public void upsert(Connection conn, Webmention mention) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (" + PLACEHOLDERS + ")" +
        " ON DUPLICATE KEY UPDATE " +
        "status=VALUES(status), mention_type=VALUES(mention_type), rsvp=VALUES(rsvp), " +
        "author_name=VALUES(author_name), author_url=VALUES(author_url), " +
        "author_photo=VALUES(author_photo), title=VALUES(title), excerpt=VALUES(excerpt), " +
        "content=VALUES(content), published=VALUES(published), " +
        "updated_at=VALUES(updated_at), metadata=VALUES(metadata)";
    JdbcTemplate.update(conn, sql, rowValues(mention));
  }
}
