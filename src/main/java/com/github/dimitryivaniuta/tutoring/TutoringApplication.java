package com.github.dimitryivaniuta.tutoring;

import com.github.dimitryivaniuta.tutoring.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Application entry point for the tutoring marketplace handlers.
 *
 * <p>There is no application-wide {@code DataSource}: every invocation fetches credentials and opens its own
 * connection through {@link com.github.dimitryivaniuta.tutoring.db.DatabaseGateway}.</p>
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableConfigurationProperties(AppProperties.class)
public class TutoringApplication {

    /**
     * Bootstraps the Spring Boot application.
     *
     * @param args CLI args
     */
    public static void main(String[] args) {
        SpringApplication.run(TutoringApplication.class, args);
    }
}
