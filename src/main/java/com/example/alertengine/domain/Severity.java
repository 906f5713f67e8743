package com.example.alertengine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Alert severity, declared from most to least urgent.
 */
public enum Severity {
    CRITICAL, HIGH, MEDIUM, LOW, INFO;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isMoreUrgentThan(Severity other) {
        return other == null || ordinal() < other.ordinal();
    }

    @JsonCreator
    public static Severity fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        return Severity.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
