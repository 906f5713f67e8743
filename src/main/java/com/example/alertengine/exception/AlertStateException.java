package com.example.alertengine.exception;

/**
 * Thrown when a lifecycle transition is not allowed from the alert's current status.
 */
public class AlertStateException extends AlertingException {

    public AlertStateException(String message) {
        super(message);
    }
}
