package com.github.dimitryivaniuta.tutoring.credentials;

/**
 * Supplies database credentials from the secret store.
 *
 * <p>Called once per invocation; implementations must not cache secrets between invocations.</p>
 */
public interface CredentialProvider {

    /**
     * Fetches the credentials for the configured secret.
     *
     * @return credentials combined with the proxy endpoint configuration
     * @throws com.github.dimitryivaniuta.tutoring.error.ConfigurationException when configuration is missing or
     *                                                                          the secret cannot be read
     */
    DatabaseCredentials fetch();
}
