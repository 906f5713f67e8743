package com.example.alertengine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why responsibility for an alert changed hands.
 */
public enum AssignmentReason {
    MANUAL, AUTO_SEVERITY, ESCALATION, ROTATION;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AssignmentReason fromCode(String code) {
        return AssignmentReason.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
