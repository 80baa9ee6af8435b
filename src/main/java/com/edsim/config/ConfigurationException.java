package com.edsim.config;

import java.util.List;

/**
 * Raised before a run starts when the parameters cannot describe a valid department.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> errors;

    public ConfigurationException(List<String> errors) {
        super("Invalid simulation configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public List<String> errors() {
        return errors;
    }
}
