package com.z254.butterfly.prism;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * PRISM - Causal Root-Cause Engine for the BUTTERFLY Ecosystem.
 *
 * <p>PRISM provides:
 * <ul>
 *   <li>Observation window - Bounded, append-only store of anomaly samples</li>
 *   <li>Causal discovery - PC skeleton search and edge orientation over observed metrics</li>
 *   <li>Effect estimation - Back-door adjusted average treatment effects on a symptom</li>
 *   <li>Root-cause ranking - Deterministic ordering of candidate causes</li>
 * </ul>
 *
 * <p>PRISM integrates with:
 * <ul>
 *   <li>PERCEPTION - Consumes anomaly observations via Kafka</li>
 *   <li>CORTEX - Publishes ranked root causes for diagnosis</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class PrismApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrismApplication.class, args);
    }
}
