package com.example.rcaengine.repository;

import com.example.rcaengine.domain.Suspect;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SuspectRepository extends JpaRepository<Suspect, String> {

    List<Suspect> findByIncidentIdOrderByRankAsc(String incidentId);

    Optional<Suspect> findByIdAndIncidentId(String id, String incidentId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Suspect s WHERE s.incidentId = :incidentId")
    int deleteByIncident(String incidentId);
}
