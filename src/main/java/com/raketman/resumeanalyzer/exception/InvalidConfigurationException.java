package com.raketman.resumeanalyzer.exception;

/**
 * Raised while the analyzer tables are built when the configured taxonomy, roles or scoring
 * tables are inconsistent. The application refuses to start.
 */
public class InvalidConfigurationException extends RuntimeException {
    public InvalidConfigurationException(String message) {
        super(message);
    }
}
