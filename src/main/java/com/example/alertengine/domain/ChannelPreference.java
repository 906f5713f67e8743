package com.example.alertengine.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Notification channels used for one severity: on first assignment and on escalation.
 */
public record ChannelPreference(
        @JsonProperty("immediate_channels") List<String> immediateChannels,
        @JsonProperty("escalation_channels") List<String> escalationChannels) {

    public ChannelPreference {
        immediateChannels = immediateChannels == null ? List.of() : List.copyOf(immediateChannels);
        escalationChannels = escalationChannels == null ? List.of() : List.copyOf(escalationChannels);
    }
}
