package com.example.alertengine.exception;

/**
 * Thrown when a rule, condition or other configuration record is missing or invalid.
 * Never resolved to either "suppress" or "allow" on the caller's behalf.
 */
public class ConfigurationException extends AlertingException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
