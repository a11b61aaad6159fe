package com.document.classification.exception;

/**
 * Thrown when the category or rule configuration is missing or malformed.
 * Always fatal: it is raised at startup, before any document is processed.
 */
public class ConfigurationException extends ClassificationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
