package com.example.rcaengine.repository;

import com.example.rcaengine.domain.LogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface LogEntryRepository extends JpaRepository<LogEntry, Long> {

    @Query("SELECT COUNT(l) FROM LogEntry l WHERE l.service IN :services AND l.level = :level " +
           "AND l.timestamp >= :from AND l.timestamp < :to")
    long countByLevel(Collection<String> services, String level, Instant from, Instant to);

    @Query("SELECT DISTINCT l.eventSignature FROM LogEntry l WHERE l.service IN :services " +
           "AND l.level = :level AND l.eventSignature IS NOT NULL " +
           "AND l.timestamp >= :from AND l.timestamp < :to")
    List<String> distinctSignatures(Collection<String> services, String level, Instant from, Instant to);
}
