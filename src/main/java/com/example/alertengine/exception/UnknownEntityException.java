package com.example.alertengine.exception;

/**
 * Thrown when an operation references an alert, window or schedule that does not exist.
 */
public class UnknownEntityException extends AlertingException {

    public UnknownEntityException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
