package com.github.dimitryivaniuta.tutoring.credentials;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.tutoring.config.AppProperties;
import com.github.dimitryivaniuta.tutoring.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads the database secret from the Spring {@link Environment}.
 *
 * <p>The secret lives under {@code secrets.<secret-id>} as a JSON document
 * {@code {"username": "...", "password": "..."}}, the same shape the secret store hands out. Environment
 * variables, mounted config trees and vault-backed property sources can all provide it. The lookup happens on
 * every call so a rotated secret is picked up by the next invocation.</p>
 */
@Component
public class EnvironmentSecretCredentialProvider implements CredentialProvider {

    /**
     * Property prefix under which secrets are resolved.
     */
    public static final String SECRET_PROPERTY_PREFIX = "secrets.";

    private static final Logger log = LoggerFactory.getLogger(EnvironmentSecretCredentialProvider.class);

    private final Environment environment;
    private final AppProperties properties;
    private final ObjectMapper objectMapper;

    public EnvironmentSecretCredentialProvider(Environment environment, AppProperties properties, ObjectMapper objectMapper) {
        this.environment = environment;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public DatabaseCredentials fetch() {
        String region = require(properties.getRegion(), "app.region");
        String secretId = require(properties.getSecretId(), "app.secret-id");
        AppProperties.Database db = properties.getDatabase();
        String host = require(db.getProxyHost(), "app.database.proxy-host");
        String database = require(db.getName(), "app.database.name");

        log.info("Fetching database credentials. secretId={} region={}", secretId, region);

        String secretJson = environment.getProperty(SECRET_PROPERTY_PREFIX + secretId);
        if (!StringUtils.hasText(secretJson)) {
            throw new ConfigurationException("Secret '" + secretId + "' not found in region " + region);
        }

        JsonNode secret;
        try {
            secret = objectMapper.readTree(secretJson);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Secret '" + secretId + "' is not valid JSON", e);
        }

        String username = text(secret, "username", secretId);
        String password = text(secret, "password", secretId);
        return new DatabaseCredentials(host, db.getPort(), database, username, password, db.getConnectTimeout());
    }

    private static String require(String value, String property) {
        if (!StringUtils.hasText(value)) {
            throw new ConfigurationException("Missing required configuration '" + property + "'");
        }
        return value;
    }

    private static String text(JsonNode secret, String field, String secretId) {
        JsonNode node = secret.get(field);
        if (node == null || !node.isTextual() || node.asText().isEmpty()) {
            throw new ConfigurationException("Secret '" + secretId + "' has no '" + field + "' field");
        }
        return node.asText();
    }
}
