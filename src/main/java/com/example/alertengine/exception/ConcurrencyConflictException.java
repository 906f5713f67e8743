package com.example.alertengine.exception;

/**
 * Raised once optimistic-locking or unique-key conflicts persist past the retry budget.
 */
public class ConcurrencyConflictException extends AlertingException {

    public ConcurrencyConflictException(String operation, int attempts, Throwable cause) {
        super(String.format("%s still conflicting after %d attempts", operation, attempts), cause);
    }
}
