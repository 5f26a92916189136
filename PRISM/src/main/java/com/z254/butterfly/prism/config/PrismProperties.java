package com.z254.butterfly.prism.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for PRISM service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Causal discovery parameters (significance, conditioning depth, budgets)</li>
 *     <li>Observation window bounds</li>
 *     <li>Effect estimation and refutation</li>
 *     <li>Threshold-gated discovery trigger</li>
 *     <li>Kafka topics and result cache</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "prism")
public class PrismProperties {

    private final Discovery discovery = new Discovery();
    private final Window window = new Window();
    private final Estimation estimation = new Estimation();
    private final Trigger trigger = new Trigger();
    private final Kafka kafka = new Kafka();
    private final Cache cache = new Cache();

    /**
     * Causal discovery configuration.
     */
    @Data
    public static class Discovery {
        /** p-value above which two variables are declared independent */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double significanceThreshold = 0.05;

        /** Largest conditioning set tried by the skeleton search */
        @PositiveOrZero
        private int maxConditioningSize = 3;

        /** Condition number above which a conditioning set is treated as ill-conditioned */
        @Positive
        private double maxConditionNumber = 1e10;

        /** Test budget multiplier: factor * variables^2 * (maxConditioningSize + 1) */
        @Positive
        private int budgetFactor = 50;

        /** Wall-clock cap for a single pass */
        private Duration maxPassDuration = Duration.ofSeconds(30);

        /** Maximum number of ranked candidates returned per pass */
        @Positive
        private int maxCandidates = 10;

        /** Top candidates below this confidence are logged as low confidence */
        private double minConfidenceThreshold = 0.6;
    }

    /**
     * Observation window bounds.
     */
    @Data
    public static class Window {
        @Positive
        private int maxObservations = 1000;

        private Duration maxAge = Duration.ofHours(1);
    }

    /**
     * Effect estimation configuration.
     */
    @Data
    public static class Estimation {
        /** Re-estimate every effect against a permuted (placebo) cause */
        private boolean placeboEnabled = true;

        /** Seed for the placebo permutation, fixed for reproducibility */
        private long placeboSeed = 42L;
    }

    /**
     * Threshold-gated discovery trigger.
     */
    @Data
    public static class Trigger {
        private boolean enabled = true;

        /** Outcome variables analysed on every trigger */
        private List<String> outcomes = new ArrayList<>(List.of("latency_ms"));

        /** Observations within the anomaly window needed to start a pass */
        @Positive
        private int anomalyThreshold = 50;

        private Duration anomalyWindow = Duration.ofMinutes(5);

        private long checkIntervalMs = 10_000L;
    }

    /**
     * Kafka configuration.
     */
    @Data
    public static class Kafka {
        private final Topics topics = new Topics();

        @Data
        public static class Topics {
            @NotBlank
            private String observations = "prism.observations";
            @NotBlank
            private String rootCauses = "prism.rca.root-causes";
        }
    }

    /**
     * Latest-result cache configuration.
     */
    @Data
    public static class Cache {
        private Duration resultTtl = Duration.ofMinutes(30);

        @Positive
        private int maxOutcomes = 100;
    }
}
