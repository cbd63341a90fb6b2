package webmention.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DataSourceConnectionProviderTest {

    @Test
    void delegatesToDataSource() throws Exception {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:provider;DB_CLOSE_DELAY=-1");
        DataSourceConnectionProvider provider = new DataSourceConnectionProvider(ds);

        try (Connection conn = provider.getConnection()) {
            assertNotNull(conn);
            assertFalse(conn.isClosed());
        }
        assertSame(ds, provider.dataSource());
    }

    @Test
    void rejectsNullDataSource() {
        assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
    }
}
