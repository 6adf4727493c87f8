package com.github.dimitryivaniuta.tutoring.db;

import com.github.dimitryivaniuta.tutoring.error.StorageException;
import java.sql.Connection;
import java.sql.SQLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * {@link DatabaseSession} over a plain JDBC connection.
 *
 * <p>The connection is wrapped in a close-suppressing {@link SingleConnectionDataSource} so that
 * {@link JdbcTemplate} reuses it for every statement and only {@link #close()} actually releases it.</p>
 */
public class JdbcDatabaseSession implements DatabaseSession {

    private static final Logger log = LoggerFactory.getLogger(JdbcDatabaseSession.class);

    private final Connection connection;
    private final JdbcTemplate jdbcTemplate;

    /**
     * Wraps an open connection and disables auto-commit on it.
     *
     * @param connection open connection, owned by this session from now on
     */
    public JdbcDatabaseSession(Connection connection) {
        this.connection = connection;
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            closeQuietly();
            throw new StorageException("Unable to prepare database connection: " + e.getMessage(), e);
        }
        this.jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
    }

    @Override
    public JdbcOperations jdbc() {
        return jdbcTemplate;
    }

    @Override
    public void commit() {
        try {
            connection.commit();
        } catch (SQLException e) {
            throw new StorageException("Commit failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw new StorageException("Rollback failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            if (!connection.isClosed()) {
                connection.rollback();
            }
        } catch (SQLException e) {
            log.warn("Rollback on close failed: {}", e.getMessage());
        } finally {
            closeQuietly();
        }
    }

    private void closeQuietly() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Closing database connection failed: {}", e.getMessage());
        }
    }
}
