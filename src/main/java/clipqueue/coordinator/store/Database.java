package clipqueue.coordinator.store;

import clipqueue.coordinator.config.QueueConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Connection pool for the local state database.
 * The schema is created on construction.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(QueueConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("clipqueue-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);
        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- KEY/VALUE CACHE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS cache_entries (
                            cache_key       VARCHAR(128) PRIMARY KEY,
                            payload         CLOB NOT NULL,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
