package com.example.rcaengine.repository;

import com.example.rcaengine.domain.MetricSample;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface MetricSampleRepository extends JpaRepository<MetricSample, Long> {

    /** Per-metric average over [from, to). */
    interface MetricAverage {
        String getMetric();

        Double getAverage();
    }

    @Query("SELECT m.metric AS metric, AVG(m.value) AS average FROM MetricSample m " +
           "WHERE m.service = :service AND m.timestamp >= :from AND m.timestamp < :to " +
           "GROUP BY m.metric")
    List<MetricAverage> averageByMetric(String service, Instant from, Instant to);

    @Query("SELECT DISTINCT m.service FROM MetricSample m ORDER BY m.service")
    List<String> findDistinctServices();

    @Query("SELECT DISTINCT m.metric FROM MetricSample m " +
           "WHERE (:service IS NULL OR m.service = :service) ORDER BY m.metric")
    List<String> findDistinctMetrics(String service);

    Optional<MetricSample> findFirstByServiceAndMetricOrderByTimestampDesc(String service, String metric);
}
