package com.example.alertengine.dispatch;

import com.example.alertengine.domain.ChannelPreference;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What the notification collaborator needs to reach a responder.
 */
public record DispatchRequest(@JsonProperty("alert_id") String alertId,
                              @JsonProperty("assignee") String assignee,
                              @JsonProperty("channel_set") List<String> channelSet,
                              @JsonProperty("expected_response_time") int expectedResponseTime,
                              @JsonProperty("level") int level,
                              @JsonProperty("severity") String severity,
                              @JsonProperty("team_id") String teamId) {

    public DispatchRequest {
        channelSet = channelSet == null ? List.of() : List.copyOf(channelSet);
    }

    /**
     * Routing channels first, then the team's immediate channels for the initial assignment
     * or its escalation channels for later levels. Duplicates are dropped.
     */
    public static List<String> channels(List<String> routingChannels, ChannelPreference preference, int level) {
        Set<String> channels = new LinkedHashSet<>(routingChannels);
        if (preference != null) {
            channels.addAll(level == 0 ? preference.immediateChannels() : preference.escalationChannels());
        }
        return new ArrayList<>(channels);
    }
}
