package inkwell.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import inkwell.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with auto-commit off.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("inkwell-db-pool");
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

            // ---------- LONG-TERM MEMORY ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS memory_entries (
                            run_id          VARCHAR(128) NOT NULL,
                            entry_key       VARCHAR(512) NOT NULL,
                            entry_value     CLOB,
                            tier            VARCHAR(16) NOT NULL,
                            written_by      VARCHAR(128),
                            written_at      TIMESTAMP NOT NULL,
                            PRIMARY KEY (run_id, entry_key)
                        );
                    """);

            // ---------- RUN ARCHIVE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS pipeline_runs (
                            id              VARCHAR(128) PRIMARY KEY,
                            topic           VARCHAR(2048) NOT NULL,
                            style_guide     VARCHAR(4096),
                            target_length   INT,
                            config          CLOB,
                            current_stage   VARCHAR(20) NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            failure_reason  VARCHAR(2048),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            finished_at     TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS stage_status (
                            run_id               VARCHAR(128) NOT NULL,
                            stage                VARCHAR(20) NOT NULL,
                            status               VARCHAR(20) NOT NULL,
                            expected_subjects    INT DEFAULT 0,
                            resolved_subjects    INT DEFAULT 0,
                            degraded_subjects    VARCHAR(2048),
                            unresolved_subjects  VARCHAR(2048),
                            missing_contributors VARCHAR(4096),
                            started_at           TIMESTAMP,
                            finished_at          TIMESTAMP,
                            PRIMARY KEY (run_id, stage)
                        );
                    """);

            // ---------- TASK LOG ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_log (
                            message_id      VARCHAR(64) PRIMARY KEY,
                            task_id         VARCHAR(64) NOT NULL,
                            run_id          VARCHAR(128) NOT NULL,
                            stage           VARCHAR(20) NOT NULL,
                            role            VARCHAR(128) NOT NULL,
                            subject         VARCHAR(256) NOT NULL,
                            attempt         INT NOT NULL,
                            outcome         VARCHAR(20) NOT NULL,
                            error_message   VARCHAR(2048),
                            dispatched_at   TIMESTAMP NOT NULL,
                            finished_at     TIMESTAMP,
                            seq             BIGINT GENERATED BY DEFAULT AS IDENTITY
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_memory_written ON memory_entries(written_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_status ON pipeline_runs(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_task_log_run ON task_log(run_id, seq);");

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
