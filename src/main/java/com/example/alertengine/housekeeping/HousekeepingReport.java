package com.example.alertengine.housekeeping;

/**
 * What one housekeeping run removed or reset.
 */
public record HousekeepingReport(int suppressionLogsDeleted,
                                 int groupsDeleted,
                                 int groupMembersDeleted,
                                 int rateLimitWindowsReset,
                                 int maintenanceWindowsClosed) {
}
