package com.z254.butterfly.prism;

import com.z254.butterfly.prism.causal.DataMatrix;
import com.z254.butterfly.prism.domain.model.Observation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntToDoubleFunction;

/**
 * Deterministic test data built from a two-level full factorial design.
 * <p>
 * {@code factor(row, k)} is -1 or +1 depending on bit {@code k} of the row index; over a
 * multiple of {@code 2^(k+1)} rows the factors are zero-mean and exactly orthogonal, which makes
 * independence and zero partial correlation exact rather than probabilistic.
 */
public final class PrismTestData {

    private PrismTestData() {}

    public static double factor(int row, int k) {
        return ((row >> k) & 1) == 0 ? -1.0 : 1.0;
    }

    public static ColumnsBuilder columns(int rows) {
        return new ColumnsBuilder(rows);
    }

    public static Observation observation(Instant timestamp, Map<String, Double> metrics) {
        return Observation.builder()
                .timestamp(timestamp)
                .serviceId("checkout-service")
                .metrics(metrics)
                .build();
    }

    public static final class ColumnsBuilder {
        private final int rows;
        private final Map<String, double[]> columns = new LinkedHashMap<>();

        private ColumnsBuilder(int rows) {
            this.rows = rows;
        }

        public ColumnsBuilder column(String name, IntToDoubleFunction values) {
            double[] column = new double[rows];
            for (int row = 0; row < rows; row++) {
                column[row] = values.applyAsDouble(row);
            }
            columns.put(name, column);
            return this;
        }

        public Map<String, double[]> build() {
            return columns;
        }

        public DataMatrix toMatrix() {
            return DataMatrix.of(columns);
        }

        /**
         * One observation per row, one second apart, ending at {@code end}.
         */
        public List<Observation> toObservations(Instant end) {
            List<Observation> observations = new ArrayList<>(rows);
            for (int row = 0; row < rows; row++) {
                Map<String, Double> metrics = new LinkedHashMap<>();
                for (Map.Entry<String, double[]> entry : columns.entrySet()) {
                    metrics.put(entry.getKey(), entry.getValue()[row]);
                }
                observations.add(observation(end.minusSeconds(rows - 1L - row), metrics));
            }
            return observations;
        }
    }
}
