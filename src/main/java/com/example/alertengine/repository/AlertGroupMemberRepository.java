package com.example.alertengine.repository;

import com.example.alertengine.domain.AlertGroupMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AlertGroupMemberRepository extends JpaRepository<AlertGroupMember, String> {

    List<AlertGroupMember> findByGroupIdOrderByJoinedAtAsc(String groupId);

    Optional<AlertGroupMember> findFirstByAlertId(String alertId);

    boolean existsByGroupIdAndAlertId(String groupId, String alertId);

    @Modifying
    @Query("DELETE FROM AlertGroupMember m WHERE m.groupId IN " +
           "(SELECT g.id FROM AlertGroup g WHERE g.id IN :groupIds AND g.lastAlertAt < :cutoff)")
    int deleteForStaleGroups(Collection<String> groupIds, Instant cutoff);
}
