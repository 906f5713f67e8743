package com.example.alertengine.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whether alerts of one severity may resolve themselves, and after how long.
 */
public record AutoResolutionPolicy(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("timeout_minutes") Integer timeoutMinutes) {

    public static AutoResolutionPolicy disabled() {
        return new AutoResolutionPolicy(false, null);
    }
}
