package com.example.alertengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertStatus {
    ACTIVE, ACKNOWLEDGED, RESOLVED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
