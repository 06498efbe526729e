package com.example.rcaengine.repository;

import com.example.rcaengine.domain.RankingModelVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RankingModelRepository extends JpaRepository<RankingModelVersion, Long> {

    Optional<RankingModelVersion> findFirstByStatus(RankingModelVersion.Status status);

    List<RankingModelVersion> findByStatus(RankingModelVersion.Status status);

    List<RankingModelVersion> findAllByOrderByVersionDesc();
}
