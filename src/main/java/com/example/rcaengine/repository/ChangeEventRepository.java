package com.example.rcaengine.repository;

import com.example.rcaengine.domain.ChangeEvent;
import com.example.rcaengine.domain.SuspectType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ChangeEventRepository extends JpaRepository<ChangeEvent, Long> {

    Optional<ChangeEvent> findByChangeTypeAndIdentifier(SuspectType changeType, String identifier);

    /** Changes for the given services in [from, to], plus global (service-less) changes. */
    @Query("SELECT c FROM ChangeEvent c WHERE c.timestamp >= :from AND c.timestamp <= :to " +
           "AND (c.service IN :services OR c.service IS NULL) ORDER BY c.timestamp DESC")
    List<ChangeEvent> findInWindow(Collection<String> services, Instant from, Instant to);
}
