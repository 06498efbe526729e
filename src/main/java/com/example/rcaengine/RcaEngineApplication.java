package com.example.rcaengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * RCA engine.
 *
 * Pipeline:
 * - Ingestion → metric samples, logs and change events
 * - Detection → robust z-score anomalies per (service, metric) series
 * - Grouping → anomalies correlated into incidents
 * - RCA → candidate changes, evidence, ranked suspects
 * - Feedback → labels, retraining, versioned learned ranking model
 * - Gateway → live activity feed over WebSocket JSON-RPC
 */
@SpringBootApplication
@EnableScheduling
public class RcaEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RcaEngineApplication.class, args);
    }
}
