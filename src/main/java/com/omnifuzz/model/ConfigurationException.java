package com.omnifuzz.model;

/**
 * An attack configuration that cannot run: wrong source count for the strategy,
 * overlapping positions, a regex that does not compile, and so on.
 * Always raised before a run starts.
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
