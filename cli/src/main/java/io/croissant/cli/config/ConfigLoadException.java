package io.croissant.cli.config;

/**
 * Thrown when configuration loading fails: an explicitly named file is missing, the YAML is
 * invalid or a value has the wrong type.
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
