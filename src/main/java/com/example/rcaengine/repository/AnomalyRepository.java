package com.example.rcaengine.repository;

import com.example.rcaengine.domain.Anomaly;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface AnomalyRepository extends JpaRepository<Anomaly, String> {

    List<Anomaly> findByIncidentIdOrderByStartTsAsc(String incidentId);

    boolean existsByIncidentIdAndOngoingTrue(String incidentId);

    @Query("SELECT MAX(a.endTs) FROM Anomaly a WHERE a.incidentId = :incidentId")
    Optional<Instant> findLatestEndTs(String incidentId);
}
