package com.example.alertengine.oncall;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Who is on call right now, and from which schedule entry.
 */
public record OnCallResolution(@JsonProperty("user") String user,
                               @JsonProperty("is_primary") boolean primary,
                               @JsonProperty("schedule_id") String scheduleId,
                               @JsonProperty("schedule_name") String scheduleName,
                               @JsonProperty("backup_user") String backupUser,
                               @JsonProperty("is_override") boolean override,
                               @JsonProperty("entry_id") String entryId) {
}
