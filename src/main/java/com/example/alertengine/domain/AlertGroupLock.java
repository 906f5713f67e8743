package com.example.alertengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row per (team, group key). Writers lock it before looking for an open group,
 * so a key never gets two groups from concurrent first alerts.
 */
@Entity
@Table(name = "alert_group_locks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertGroupLock {

    @Id
    @Column(length = 800)
    private String id;

    @Column(name = "team_id")
    private String teamId;

    @Column(name = "group_key", nullable = false, length = 500)
    private String groupKey;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public static String idFor(String teamId, String groupKey) {
        return (teamId == null ? "" : teamId) + "|" + groupKey;
    }
}
