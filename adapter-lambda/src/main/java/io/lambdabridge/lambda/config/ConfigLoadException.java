package io.lambdabridge.lambda.config;

/**
 * Thrown when configuration loading fails: unreadable file, invalid YAML or an invalid value
 * in the file or the environment. Raised during cold-start setup, never per invocation.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
