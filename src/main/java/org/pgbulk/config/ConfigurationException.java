package org.pgbulk.config;

/**
 * A job definition that cannot run: no files registered, an unresolved column
 * reference or a malformed table specification. Raised before any database work.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
