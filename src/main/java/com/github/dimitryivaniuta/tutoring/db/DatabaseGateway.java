package com.github.dimitryivaniuta.tutoring.db;

import com.github.dimitryivaniuta.tutoring.credentials.DatabaseCredentials;

/**
 * Opens connections through the database proxy.
 */
public interface DatabaseGateway {

    /**
     * Opens a new session backed by exactly one connection.
     *
     * <p>The caller owns the session and must close it, typically with try-with-resources.</p>
     *
     * @param credentials credentials and endpoint
     * @return open session with auto-commit disabled
     * @throws com.github.dimitryivaniuta.tutoring.error.StorageException if the connection cannot be opened
     */
    DatabaseSession open(DatabaseCredentials credentials);
}
