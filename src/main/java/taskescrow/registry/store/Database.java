package taskescrow.registry.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import taskescrow.registry.config.RegistryConfig;
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

    /**
     * Unit of work executed on a single connection inside one transaction.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    public Database(RegistryConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("taskescrow-db-pool");
        hikariConfig.setAutoCommit(false);

        // H2 specific settings
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

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
     * Run work in one transaction: commit on success, roll back on any exception.
     * Runtime exceptions thrown by the work propagate unchanged after the rollback.
     */
    public <T> T inTransaction(SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackError) {
                    e.addSuppressed(rollbackError);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Database transaction failed: " + e.getMessage(), e);
        }
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

            // ---------- REGISTRY STATE (single row, id = 1) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS registry_state (
                            id                       INT PRIMARY KEY,
                            owner                    VARCHAR(256) NOT NULL,
                            platform_fee_percentage  INT NOT NULL,
                            task_counter             BIGINT NOT NULL DEFAULT 0,
                            held_balance             BIGINT NOT NULL DEFAULT 0
                        );
                    """);

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id                    BIGINT PRIMARY KEY,
                            title                 VARCHAR(1024) NOT NULL,
                            description           CLOB,
                            reward                BIGINT NOT NULL,
                            client                VARCHAR(256) NOT NULL,
                            freelancer            VARCHAR(256),
                            status                VARCHAR(20) NOT NULL,
                            deadline              TIMESTAMP(9) WITH TIME ZONE NOT NULL,
                            freelancer_submitted  BOOLEAN DEFAULT FALSE NOT NULL,
                            client_approved       BOOLEAN DEFAULT FALSE NOT NULL
                        );
                    """);

            // ---------- USER TASK LISTS (append-only) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS user_tasks (
                            identity   VARCHAR(256) NOT NULL,
                            seq        INT NOT NULL,
                            task_id    BIGINT NOT NULL,
                            PRIMARY KEY (identity, seq)
                        );
                    """);

            // ---------- COMPLETION COUNTERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS completed_task_counts (
                            identity         VARCHAR(256) PRIMARY KEY,
                            completed_count  BIGINT NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status ON tasks(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_client ON tasks(client);");

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
