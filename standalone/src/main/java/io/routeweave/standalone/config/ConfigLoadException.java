package io.routeweave.standalone.config;

/**
 * Thrown when the configuration file cannot be read or holds an invalid
 * value. Startup aborts on this exception.
 */
public final class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
