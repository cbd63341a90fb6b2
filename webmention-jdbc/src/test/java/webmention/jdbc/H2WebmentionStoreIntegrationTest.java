package webmention.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import webmention.jdbc.store.H2WebmentionStore;

import java.util.UUID;

class H2WebmentionStoreIntegrationTest extends AbstractWebmentionStoreIntegrationTest {

    private JdbcWebmentionStore store;

    @BeforeEach
    void setUp() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        store = new JdbcWebmentionStore(new DataSourceConnectionProvider(dataSource), new H2WebmentionStore());
        store.createSchema();
    }

    @Override
    JdbcWebmentionStore store() {
        return store;
    }
}
