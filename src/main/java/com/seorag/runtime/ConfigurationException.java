package com.seorag.runtime;

/**
 * Fatal startup problem that an operator has to fix: a missing credential, an unreadable corpus
 * directory, or a configuration file that cannot be bound.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
