package webmention.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies JDBC connections to {@link JdbcWebmentionStore}.
 *
 * <p>Every returned connection is closed by the caller once the operation completes.
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a connection.
     *
     * @return an open connection
     * @throws SQLException if no connection can be obtained
     */
    Connection getConnection() throws SQLException;
}
