package com.github.dimitryivaniuta.tutoring.credentials;

import java.time.Duration;

/**
 * Everything needed to open a connection through the database proxy.
 *
 * @param host           proxy endpoint host
 * @param port           proxy endpoint port
 * @param database       database name
 * @param username       login taken from the secret
 * @param password       password taken from the secret
 * @param connectTimeout upper bound for opening the connection
 */
public record DatabaseCredentials(
        String host,
        int port,
        String database,
        String username,
        String password,
        Duration connectTimeout
) {

    @Override
    public String toString() {
        return "DatabaseCredentials[host=" + host + ", port=" + port + ", database=" + database
                + ", username=" + username + "]";
    }
}
