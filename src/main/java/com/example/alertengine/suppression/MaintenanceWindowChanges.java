package com.example.alertengine.suppression;

import com.example.alertengine.domain.Recurrence;
import com.example.alertengine.domain.Severity;

import java.time.Instant;
import java.util.Set;

/**
 * Partial update of a maintenance window. A null component leaves the stored value unchanged.
 */
public record MaintenanceWindowChanges(String name,
                                       String description,
                                       Instant startTime,
                                       Instant endTime,
                                       String timezone,
                                       Set<String> affectedSystems,
                                       Set<Severity> affectedSeverities,
                                       Boolean suppressAll,
                                       Integer priority,
                                       Integer notifyBeforeMinutes,
                                       Boolean enabled,
                                       Boolean recurring,
                                       Recurrence recurrence) {
}
