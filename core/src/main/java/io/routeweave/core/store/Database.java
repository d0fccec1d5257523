package io.routeweave.core.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pooled access to the relational store.
 *
 * <p>
 * {@link #inTransaction(SqlWork)} runs one unit of work on one connection
 * in its own transaction: committed when the work returns, rolled back when
 * it throws. Callers never see a connection outside a unit of work.
 */
public final class Database implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Database.class);

    static final String SCHEMA_SCRIPT = "classpath:/db/schema.sql";

    /** A unit of work against one connection. */
    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    private final DataSource dataSource;

    public Database(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    /**
     * Opens a HikariCP pool against the given JDBC URL.
     *
     * @param jdbcUrl     JDBC URL, e.g. {@code jdbc:h2:file:./data/routeweave}
     * @param username    user, may be null
     * @param password    password, may be null
     * @param maxPoolSize maximum pool size
     */
    public static Database open(String jdbcUrl, String username, String password, int maxPoolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        if (username != null) {
            hikariConfig.setUsername(username);
        }
        if (password != null) {
            hikariConfig.setPassword(password);
        }
        hikariConfig.setMaximumPoolSize(maxPoolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setPoolName("routeweave-db");
        LOG.info("Opening database pool: url={}, maxPoolSize={}", jdbcUrl, maxPoolSize);
        return new Database(new HikariDataSource(hikariConfig));
    }

    /** Creates any missing tables and singleton rows. Idempotent. */
    public void migrate() {
        withConnection(connection -> {
            try (Statement statement = connection.createStatement()) {
                statement.execute("RUNSCRIPT FROM '" + SCHEMA_SCRIPT + "'");
            }
            return null;
        });
        LOG.info("Database schema is up to date");
    }

    /**
     * Runs {@code work} in its own transaction.
     *
     * @throws StoreException if the work or the commit fails; the transaction
     *                        has been rolled back
     */
    public <T> T inTransaction(SqlWork<T> work) {
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                T result = work.run(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StoreException("Transaction failed: " + e.getMessage(), e);
        }
    }

    /** Runs {@code work} on a pooled connection in auto-commit mode. */
    public <T> T withConnection(SqlWork<T> work) {
        try (Connection connection = dataSource.getConnection()) {
            return work.run(connection);
        } catch (SQLException e) {
            throw new StoreException("Database access failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource hikari) {
            hikari.close();
            LOG.info("Database pool closed");
        }
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            LOG.warn("Rollback failed: {}", e.getMessage());
        }
    }
}
