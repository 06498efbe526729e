package com.example.rcaengine.repository;

import com.example.rcaengine.domain.ActivityEvent;
import com.example.rcaengine.domain.ActivityType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface ActivityEventRepository extends JpaRepository<ActivityEvent, Long> {

    @Query("SELECT e FROM ActivityEvent e WHERE e.sequence > :cursor " +
           "AND (:type IS NULL OR e.type = :type) " +
           "AND (:service IS NULL OR e.service = :service) " +
           "ORDER BY e.sequence ASC")
    List<ActivityEvent> findSince(long cursor, ActivityType type, String service, Pageable pageable);

    List<ActivityEvent> findAllByOrderBySequenceDesc(Pageable pageable);

    @Modifying
    @Transactional
    @Query("DELETE FROM ActivityEvent e WHERE e.timestamp < :cutoff")
    int deleteOlderThan(Instant cutoff);
}
