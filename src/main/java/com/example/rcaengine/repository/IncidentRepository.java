package com.example.rcaengine.repository;

import com.example.rcaengine.domain.Incident;
import com.example.rcaengine.domain.RcaStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface IncidentRepository extends JpaRepository<Incident, String> {

    List<Incident> findByStatusOrderByStartTsDesc(Incident.IncidentStatus status);

    List<Incident> findAllByOrderByStartTsDesc();

    List<Incident> findByCorrelationKeyAndStatusOrderByLastActivityTsDesc(
            String correlationKey, Incident.IncidentStatus status);

    @Modifying
    @Transactional
    @Query("UPDATE Incident i SET i.rcaStatus = :status WHERE i.id = :id")
    int updateRcaStatus(String id, RcaStatus status);

    @Modifying
    @Transactional
    @Query("UPDATE Incident i SET i.rcaStatus = :status, i.rcaFailureCount = i.rcaFailureCount + 1, " +
           "i.lastRcaError = :error WHERE i.id = :id")
    int revertRcaStatus(String id, RcaStatus status, String error);

    @Modifying
    @Transactional
    @Query("UPDATE Incident i SET i.rcaStatus = com.example.rcaengine.domain.RcaStatus.COMPLETED, " +
           "i.suspectsCount = :suspectsCount, i.lastRcaAt = :completedAt, i.rankingMode = :rankingMode, " +
           "i.modelVersion = :modelVersion, i.rcaFailureCount = 0, i.lastRcaError = null WHERE i.id = :id")
    int markRcaCompleted(String id, int suspectsCount, Instant completedAt, String rankingMode, Long modelVersion);
}
