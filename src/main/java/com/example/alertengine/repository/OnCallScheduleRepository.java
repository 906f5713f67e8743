package com.example.alertengine.repository;

import com.example.alertengine.domain.OnCallSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OnCallScheduleRepository extends JpaRepository<OnCallSchedule, String> {

    List<OnCallSchedule> findByTeamIdOrderByCreatedAtAsc(String teamId);
}
