package com.github.dimitryivaniuta.tutoring.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level configuration properties.
 *
 * <p>Nothing here is validated at startup. Handlers read the values they need when they are invoked and
 * fail that invocation with a {@code ConfigurationException} if a required one is missing.</p>
 */
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    /**
     * Region of the secret store and the message channel.
     */
    private String region;

    /**
     * Identifier of the secret holding the database username and password.
     */
    private String secretId;

    private final Database database = new Database();
    private final Settlement settlement = new Settlement();
    private final Cors cors = new Cors();

    @Getter
    @Setter
    public static class Database {
        /**
         * Host name of the database proxy endpoint.
         */
        private String proxyHost;

        /**
         * Port of the database proxy endpoint.
         */
        private int port = 5432;

        /**
         * Database (schema) name.
         */
        private String name;

        /**
         * Upper bound for opening a connection through the proxy.
         */
        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Settlement {
        /**
         * Address (Kafka topic) of the settlement-request channel.
         */
        private String topic;

        /**
         * How long to wait for the broker to acknowledge a published settlement request.
         */
        private Duration sendTimeout = Duration.ofSeconds(5);

        /**
         * Partitions used when the topic is created by the application (local/dev only).
         */
        private int partitions = 3;

        /**
         * Probability that a pending payment is settled as paid rather than cancelled.
         */
        private double paidProbability = 0.5;

        /**
         * First delay before a failed settlement batch is retried.
         */
        private Duration retryInitialInterval = Duration.ofSeconds(1);

        /**
         * Upper bound of the delay between retries of a failed settlement batch.
         */
        private Duration retryMaxInterval = Duration.ofMinutes(1);
    }

    @Getter
    @Setter
    public static class Cors {
        private String allowOrigin = "*";
        private String allowHeaders = "Content-Type";
    }
}
