package com.example.alertengine.suppression;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SuppressionReason {
    MAINTENANCE_WINDOW,
    DUPLICATE_ALERT,
    RATE_LIMIT_EXCEEDED,
    CUSTOM_RULE,
    NO_SUPPRESSION;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SuppressionReason fromCode(String code) {
        return SuppressionReason.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
