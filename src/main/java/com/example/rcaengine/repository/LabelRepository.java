package com.example.rcaengine.repository;

import com.example.rcaengine.domain.Label;
import com.example.rcaengine.domain.SuspectType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LabelRepository extends JpaRepository<Label, Long> {

    List<Label> findBySuspectTypeAndServiceOrderByIdAsc(SuspectType suspectType, String service);

    List<Label> findAllByOrderByIdAsc();

    List<Label> findByIncidentIdOrderByIdAsc(String incidentId);

    /** Number of distinct (incident, suspect) pairs that carry a label. */
    @Query("SELECT COUNT(DISTINCT CONCAT(l.incidentId, '|', l.suspectId)) FROM Label l")
    long countLabeledSuspects();
}
