package com.example.alertengine.exception;

import java.time.Instant;

/**
 * Thrown on write when a time range does not end after it starts.
 */
public class TimingInvariantException extends AlertingException {

    public TimingInvariantException(String subject, Instant start, Instant end) {
        super(String.format("%s must end after it starts (start=%s, end=%s)", subject, start, end));
    }
}
