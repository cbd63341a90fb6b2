package webmention.jdbc;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import webmention.jdbc.store.PostgresWebmentionStore;

import java.sql.Connection;
import java.sql.Statement;

@ContainerBackedStore("PostgreSQL")
@Testcontainers
class PostgresWebmentionStoreIntegrationTest extends AbstractWebmentionStoreIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("webmention_test");

    private static SimpleDataSource dataSource;
    private static JdbcWebmentionStore store;

    @BeforeAll
    static void initSchema() {
        dataSource = new SimpleDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        store = new JdbcWebmentionStore(new DataSourceConnectionProvider(dataSource), new PostgresWebmentionStore());
        store.createSchema();
    }

    @BeforeEach
    void truncate() throws Exception {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("TRUNCATE TABLE webmention");
        }
    }

    @Override
    JdbcWebmentionStore store() {
        return store;
    }
}
