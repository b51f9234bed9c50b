package io.cardfederation.exceptions;

/**
 * A platform is not configured well enough to be used, e.g. enabled without a base URL
 * or not registered with the sync engine. Raised before any network call.
 */
public class ConfigurationException extends FederationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
