package com.example.alertengine.exception;

/**
 * Base type for failures the decision engine surfaces to its callers.
 */
public class AlertingException extends RuntimeException {

    public AlertingException(String message) {
        super(message);
    }

    public AlertingException(String message, Throwable cause) {
        super(message, cause);
    }
}
