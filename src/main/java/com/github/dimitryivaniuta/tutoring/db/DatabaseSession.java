package com.github.dimitryivaniuta.tutoring.db;

import org.springframework.jdbc.core.JdbcOperations;

/**
 * One database connection scoped to a single handler invocation.
 *
 * <p>Auto-commit is off. Work becomes durable only through {@link #commit()}; anything left uncommitted is
 * rolled back by {@link #close()}.</p>
 */
public interface DatabaseSession extends AutoCloseable {

    /**
     * Statement executor bound to this session's connection.
     *
     * @return jdbc operations
     */
    JdbcOperations jdbc();

    /**
     * Commits the current transaction.
     */
    void commit();

    /**
     * Rolls back the current transaction.
     */
    void rollback();

    /**
     * Releases the connection. Never throws.
     */
    @Override
    void close();
}
