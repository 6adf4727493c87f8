package com.github.dimitryivaniuta.tutoring.error;

/**
 * Required external configuration is missing, or the credential fetch failed.
 *
 * <p>Indicates a deployment problem rather than a caller error.</p>
 */
public class ConfigurationException extends TutoringException {

    public ConfigurationException(String message) {
        this(message, null);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(500, "CONFIGURATION_ERROR", message, cause);
    }
}
