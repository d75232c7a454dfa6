package gpulane.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import gpulane.coordinator.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(SchedulerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("gpulane-db-pool");
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

    /**
     * Check if database is healthy.
     */
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

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id               VARCHAR(64) PRIMARY KEY,
                            model            VARCHAR(64) NOT NULL,
                            kind             VARCHAR(16) NOT NULL,
                            mode             VARCHAR(32),
                            parameters       CLOB NOT NULL,
                            status           VARCHAR(20) DEFAULT 'pending',
                            progress         INT DEFAULT 0,
                            error_message    VARCHAR(2048),
                            result_location  VARCHAR(2048),
                            lane_mode        VARCHAR(32),
                            fallback_reason  VARCHAR(16),
                            fallback_activated BOOLEAN DEFAULT FALSE NOT NULL,
                            stage            VARCHAR(64),
                            created_at       TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at       TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at       TIMESTAMP,
                            finished_at      TIMESTAMP
                        );
                    """);

            // ---------- OPERATIONAL EVENTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS operational_events (
                            id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            event_type  VARCHAR(32) NOT NULL,
                            task_id     VARCHAR(64),
                            model       VARCHAR(64),
                            lane_mode   VARCHAR(32),
                            event_value VARCHAR(256),
                            reason      VARCHAR(256),
                            created_at  TIMESTAMP NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status_created ON tasks(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_kind_status ON tasks(kind, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_events_type ON operational_events(event_type);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_events_task ON operational_events(task_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
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
