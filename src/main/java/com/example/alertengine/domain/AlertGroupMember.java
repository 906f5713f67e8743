package com.example.alertengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "alert_group_members",
        uniqueConstraints = @UniqueConstraint(name = "uq_group_member", columnNames = {"group_id", "alert_id"}),
        indexes = @Index(name = "idx_group_members_alert", columnList = "alert_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertGroupMember {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "group_id", nullable = false)
    private String groupId;

    @Column(name = "alert_id", nullable = false)
    private String alertId;

    private boolean suppressed;

    @Column(name = "joined_at", nullable = false)
    private Instant joinedAt;
}
