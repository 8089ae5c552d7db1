package io.flowforge.formula.standalone.config;

/**
 * Thrown when the server configuration cannot be loaded: missing file, invalid YAML, a
 * malformed environment override, or an out-of-range value. The message is meant for startup
 * error output.
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
