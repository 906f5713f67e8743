package com.example.alertengine.suppression;

import com.example.alertengine.domain.MaintenanceWindow;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maintenance picture for a team: what is running now, what starts within the next day.
 */
public record MaintenanceStatus(@JsonProperty("team_id") String teamId,
                                @JsonProperty("active_windows") List<MaintenanceWindow> activeWindows,
                                @JsonProperty("upcoming_windows") List<MaintenanceWindow> upcomingWindows,
                                @JsonProperty("affected_systems") Set<String> affectedSystems,
                                @JsonProperty("suppression_level") Level suppressionLevel) {

    public enum Level {
        NONE, PARTIAL, FULL;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @JsonProperty("in_maintenance")
    public boolean inMaintenance() {
        return !activeWindows.isEmpty();
    }
}
