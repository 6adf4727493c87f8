package com.github.dimitryivaniuta.tutoring.db;

import com.github.dimitryivaniuta.tutoring.credentials.DatabaseCredentials;
import com.github.dimitryivaniuta.tutoring.error.StorageException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Opens PostgreSQL connections through the database proxy with a bounded connect timeout.
 *
 * <p>No pool: the proxy multiplexes connections, and each invocation holds at most one.</p>
 */
@Component
public class JdbcDatabaseGateway implements DatabaseGateway {

    private static final Logger log = LoggerFactory.getLogger(JdbcDatabaseGateway.class);

    static final String APPLICATION_NAME = "tutoring-marketplace-handlers";

    @Override
    public DatabaseSession open(DatabaseCredentials credentials) {
        String url = jdbcUrl(credentials);
        long timeoutSeconds = Math.max(1L, credentials.connectTimeout().toSeconds());

        Properties props = new Properties();
        props.setProperty("user", credentials.username());
        props.setProperty("password", credentials.password());
        props.setProperty("connectTimeout", Long.toString(timeoutSeconds));
        props.setProperty("loginTimeout", Long.toString(timeoutSeconds));
        props.setProperty("ApplicationName", APPLICATION_NAME);

        long t0 = System.nanoTime();
        try {
            Connection connection = DriverManager.getConnection(url, props);
            log.debug("Connected to {} in {}ms", url, (System.nanoTime() - t0) / 1_000_000);
            return new JdbcDatabaseSession(connection);
        } catch (SQLException e) {
            throw new StorageException("Unable to connect to database at " + credentials.host() + ":"
                    + credentials.port() + ": " + e.getMessage(), e);
        }
    }

    static String jdbcUrl(DatabaseCredentials credentials) {
        return "jdbc:postgresql://" + credentials.host() + ":" + credentials.port() + "/" + credentials.database();
    }
}
