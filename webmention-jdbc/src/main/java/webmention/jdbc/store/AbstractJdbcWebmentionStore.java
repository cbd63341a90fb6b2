package webmention.jdbc.store;

import webmention.jdbc.JdbcTemplate;
import webmention.jdbc.TableNames;
import webmention.jdbc.WebmentionStoreException;
import webmention.model.MentionType;
import webmention.model.RsvpValue;
import webmention.model.Webmention;
import webmention.model.WebmentionDirection;
import webmention.model.WebmentionStatus;
import webmention.util.MetadataJson;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Base JDBC mention store with standard SQL implementations.
 *
 * <p>Rows are keyed by {@code mention_id}, the hex SHA-256 of source, target and direction,
 * so arbitrarily long URLs never hit index size limits. Subclasses override {@link #upsert}
 * with a database-specific single-statement upsert. Register custom implementations via
 * {@code META-INF/services/webmention.jdbc.store.AbstractJdbcWebmentionStore}.
 *
 * <p>Every method works on a caller-supplied connection and neither commits nor closes it.
 *
 * @see JdbcWebmentionStores
 */
public abstract class AbstractJdbcWebmentionStore {

  protected static final String COLUMNS =
      "mention_id, source, target, direction, status, mention_type, rsvp, " +
      "author_name, author_url, author_photo, title, excerpt, content, published, " +
      "created_at, updated_at, metadata";

  protected static final String PLACEHOLDERS = "?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?";

  protected static final JdbcTemplate.RowMapper<Webmention> ROW_MAPPER = rs -> {
    Timestamp published = rs.getTimestamp("published");
    String rsvp = rs.getString("rsvp");
    return Webmention.builder()
        .source(rs.getString("source"))
        .target(rs.getString("target"))
        .direction(WebmentionDirection.fromCode(rs.getString("direction")))
        .status(WebmentionStatus.fromCode(rs.getInt("status")))
        .mentionType(MentionType.valueOf(rs.getString("mention_type")))
        .rsvp(rsvp == null ? null : RsvpValue.valueOf(rsvp))
        .authorName(rs.getString("author_name"))
        .authorUrl(rs.getString("author_url"))
        .authorPhoto(rs.getString("author_photo"))
        .title(rs.getString("title"))
        .excerpt(rs.getString("excerpt"))
        .content(rs.getString("content"))
        .published(published == null ? null : published.toInstant())
        .createdAt(rs.getTimestamp("created_at").toInstant())
        .updatedAt(rs.getTimestamp("updated_at").toInstant())
        .metadata(MetadataJson.read(rs.getString("metadata")))
        .build();
  };

  private final String tableName;

  protected AbstractJdbcWebmentionStore() {
    this(TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcWebmentionStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same kind working on another table.
   */
  public abstract AbstractJdbcWebmentionStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  /**
   * Classpath location of the DDL for this store, e.g. {@code schema/h2.sql}.
   */
  public String schemaResource() {
    return "schema/" + name() + ".sql";
  }

  /**
   * Creates the mention table and its indexes if they do not exist yet.
   *
   * @param conn the connection to run the DDL on
   */
  public void createSchema(Connection conn) {
    String script = loadSchema().replace(TableNames.DEFAULT_TABLE, tableName());
    JdbcTemplate.executeScript(conn, script);
  }

  /**
   * Inserts the mention or overwrites every column except {@code created_at}.
   */
  public void upsert(Connection conn, Webmention mention) {
    String update = "UPDATE " + tableName() + " SET " +
        "status=?, mention_type=?, rsvp=?, author_name=?, author_url=?, author_photo=?, " +
        "title=?, excerpt=?, content=?, published=?, updated_at=?, metadata=? " +
        "WHERE mention_id=?";
    int updated = JdbcTemplate.update(conn, update,
        mention.status().code(), mention.mentionType().name(), rsvpName(mention),
        mention.authorName(), mention.authorUrl(), mention.authorPhoto(),
        mention.title(), mention.excerpt(), mention.content(), timestamp(mention.published()),
        timestamp(mention.updatedAt()), MetadataJson.write(mention.metadata()),
        mentionId(mention));
    if (updated == 0) {
      insert(conn, mention);
    }
  }

  protected void insert(Connection conn, Webmention mention) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (" + PLACEHOLDERS + ")";
    JdbcTemplate.update(conn, sql, rowValues(mention));
  }

  /**
   * Marks a stored mention {@code DELETED}.
   *
   * @return rows changed: 0 when absent or already deleted
   */
  public int markDeleted(Connection conn, String source, String target,
      WebmentionDirection direction, Instant at) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + WebmentionStatus.DELETED.code() + ", updated_at=?" +
        " WHERE mention_id=? AND status<>" + WebmentionStatus.DELETED.code();
    return JdbcTemplate.update(conn, sql, timestamp(at), mentionId(source, target, direction));
  }

  public Optional<Webmention> find(Connection conn, String source, String target,
      WebmentionDirection direction) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE mention_id=?";
    List<Webmention> rows = JdbcTemplate.query(conn, sql, ROW_MAPPER,
        mentionId(source, target, direction));
    return rows.stream().findFirst();
  }

  /**
   * Confirmed mentions of a resource: matched on {@code target} for incoming,
   * {@code source} for outgoing. Oldest first.
   */
  public List<Webmention> retrieve(Connection conn, String resource, WebmentionDirection direction) {
    String column = direction == WebmentionDirection.IN ? "target" : "source";
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE " + column + "=? AND direction=? AND status=" + WebmentionStatus.CONFIRMED.code() +
        " ORDER BY created_at, mention_id";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, resource, direction.code());
  }

  /**
   * Number of rows in any status.
   */
  public int count(Connection conn) {
    return JdbcTemplate.query(conn, "SELECT COUNT(*) FROM " + tableName(), rs -> rs.getInt(1))
        .get(0);
  }

  protected Object[] rowValues(Webmention mention) {
    return new Object[]{
        mentionId(mention), mention.source(), mention.target(), mention.direction().code(),
        mention.status().code(), mention.mentionType().name(), rsvpName(mention),
        mention.authorName(), mention.authorUrl(), mention.authorPhoto(),
        mention.title(), mention.excerpt(), mention.content(), timestamp(mention.published()),
        timestamp(mention.createdAt()), timestamp(mention.updatedAt()),
        MetadataJson.write(mention.metadata())};
  }

  /**
   * Storage key of a mention identity: lowercase hex SHA-256 of
   * {@code source + '\n' + target + '\n' + direction.code()}.
   */
  public static String mentionId(String source, String target, WebmentionDirection direction) {
    String identity = source + '\n' + target + '\n' + direction.code();
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(identity.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  protected static String mentionId(Webmention mention) {
    return mentionId(mention.source(), mention.target(), mention.direction());
  }

  // Columns hold microseconds at best; truncate so a re-read compares equal.
  protected static Timestamp timestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant.truncatedTo(ChronoUnit.MICROS));
  }

  private static String rsvpName(Webmention mention) {
    return mention.rsvp() == null ? null : mention.rsvp().name();
  }

  private String loadSchema() {
    String resource = schemaResource();
    try (InputStream in = AbstractJdbcWebmentionStore.class.getClassLoader()
        .getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Schema resource not found: " + resource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new WebmentionStoreException("Failed to read " + resource, e);
    }
  }
}
