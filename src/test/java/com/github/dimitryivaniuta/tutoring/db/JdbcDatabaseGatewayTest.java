package com.github.dimitryivaniuta.tutoring.db;

import com.github.dimitryivaniuta.tutoring.credentials.DatabaseCredentials;
import com.github.dimitryivaniuta.tutoring.error.StorageException;
import java.time.Duration;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class JdbcDatabaseGatewayTest {

    @Test
    void buildsPostgresUrlFromProxyEndpoint() {
        DatabaseCredentials credentials = new DatabaseCredentials(
                "proxy.internal", 6432, "tutoring", "app", "secret", Duration.ofSeconds(10));

        Assertions.assertEquals("jdbc:postgresql://proxy.internal:6432/tutoring", JdbcDatabaseGateway.jdbcUrl(credentials));
    }

    @Test
    void unreachableEndpointFailsWithStorageError() {
        DatabaseCredentials credentials = new DatabaseCredentials(
                "127.0.0.1", 1, "tutoring", "app", "secret", Duration.ofSeconds(1));

        StorageException ex = Assertions.assertThrows(StorageException.class,
                () -> new JdbcDatabaseGateway().open(credentials));
        Assertions.assertTrue(ex.getMessage().startsWith("Unable to connect to database at 127.0.0.1:1"));
        Assertions.assertEquals(500, ex.getHttpStatus());
    }

    @Test
    void credentialsNeverPrintPassword() {
        DatabaseCredentials credentials = new DatabaseCredentials(
                "proxy.internal", 5432, "tutoring", "app", "s3cr3t", Duration.ofSeconds(10));

        Assertions.assertFalse(credentials.toString().contains("s3cr3t"));
    }
}
