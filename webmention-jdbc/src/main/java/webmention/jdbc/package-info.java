/**
 * JDBC persistence for mentions.
 *
 * <p>{@link webmention.jdbc.JdbcWebmentionStore} adapts the connection-level statements of
 * {@link webmention.jdbc.store.AbstractJdbcWebmentionStore} to the
 * {@link webmention.spi.WebmentionStore} contract, one transaction per call.
 *
 * @see webmention.jdbc.store.JdbcWebmentionStores
 */
package webmention.jdbc;
