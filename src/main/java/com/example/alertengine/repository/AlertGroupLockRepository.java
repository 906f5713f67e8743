package com.example.alertengine.repository;

import com.example.alertengine.domain.AlertGroupLock;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AlertGroupLockRepository extends JpaRepository<AlertGroupLock, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM AlertGroupLock l WHERE l.id = :id")
    Optional<AlertGroupLock> lockById(String id);
}
