package org.fielddispatch.engine.exception;

/**
 * Thrown when the engine is configured with values it cannot operate on,
 * such as scoring weights that do not sum to 1.0 or an unknown algorithm name.
 * Never recovered from; callers are expected to abort startup.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
