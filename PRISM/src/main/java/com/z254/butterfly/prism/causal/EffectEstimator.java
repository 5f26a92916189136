package com.z254.butterfly.prism.causal;

import com.z254.butterfly.prism.config.PrismProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.apache.commons.math3.util.MathArrays;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Back-door adjusted effect estimation.
 * <p>
 * The outcome is regressed on the candidate cause together with the cause's parents in the
 * graph. The coefficient of the cause is the average treatment effect under a linear model.
 * Confidence is {@code 1 - p} of the coefficient's t-test.
 */
@Slf4j
@Component
public class EffectEstimator {

    private static final double CONFIDENCE_LEVEL = 0.95;

    /** Rows needed beyond the regressor count, matching the {@code |S| + 4} floor of the Fisher-z test */
    private static final int MIN_EXTRA_ROWS = 3;

    private final PrismProperties.Estimation settings;

    public EffectEstimator(PrismProperties properties) {
        this.settings = properties.getEstimation();
    }

    public EffectEstimation estimate(String cause, String outcome, CausalGraph graph,
                                     DataMatrix data, double significanceThreshold) {
        if (cause.equals(outcome)) {
            throw new IllegalArgumentException("Cause and outcome must differ: " + cause);
        }

        List<String> path = graph.causalPath(cause, outcome);
        if (path.isEmpty()) {
            return EffectEstimation.excluded(DiscoveryIssue.NO_PATH_TO_OUTCOME);
        }
        if (!data.hasVariable(cause) || data.isDegenerate(cause)) {
            return EffectEstimation.excluded(DiscoveryIssue.DEGENERATE_VARIABLE);
        }

        List<String> adjustmentSet = new ArrayList<>();
        for (String parent : graph.parentsOf(cause)) {
            if (!parent.equals(outcome) && data.hasVariable(parent)) {
                adjustmentSet.add(parent);
            }
        }

        List<String> regressors = new ArrayList<>();
        regressors.add(cause);
        regressors.addAll(adjustmentSet);
        List<String> involved = new ArrayList<>(regressors);
        involved.add(outcome);

        int[] rows = data.completeRows(involved);
        int n = rows.length;
        int degreesOfFreedom = n - regressors.size() - 1;
        if (n < regressors.size() + MIN_EXTRA_ROWS) {
            return EffectEstimation.excluded(DiscoveryIssue.INSUFFICIENT_DATA);
        }

        double[] y = data.column(outcome, rows);
        double[][] x = data.sample(regressors, rows);
        double[] causeValues = data.column(cause, rows);
        if (!(StatUtils.variance(causeValues) > 0.0)) {
            return EffectEstimation.excluded(DiscoveryIssue.DEGENERATE_VARIABLE);
        }

        Coefficient effect;
        try {
            effect = fit(y, x, degreesOfFreedom);
        } catch (MathIllegalArgumentException e) {
            log.debug("Regression of {} on {} failed: {}", outcome, regressors, e.getMessage());
            return EffectEstimation.excluded(DiscoveryIssue.NUMERIC_INSTABILITY);
        }
        if (!Double.isFinite(effect.value()) || Double.isNaN(effect.standardError())) {
            return EffectEstimation.excluded(DiscoveryIssue.NUMERIC_INSTABILITY);
        }

        double halfWidth = effect.standardError() == 0.0
                ? 0.0
                : new TDistribution(degreesOfFreedom).inverseCumulativeProbability(0.5 + CONFIDENCE_LEVEL / 2)
                        * effect.standardError();

        RootCauseCandidate candidate = RootCauseCandidate.builder()
                .variable(cause)
                .estimatedEffect(effect.value())
                .standardError(effect.standardError())
                .pValue(effect.pValue())
                .confidence(clamp(1.0 - effect.pValue()))
                .confidenceIntervalLower(effect.value() - halfWidth)
                .confidenceIntervalUpper(effect.value() + halfWidth)
                .pathToOutcome(path)
                .adjustmentSet(adjustmentSet)
                .sampleSize(n)
                .refutation(settings.isPlaceboEnabled()
                        ? refute(cause, y, x, degreesOfFreedom, significanceThreshold)
                        : null)
                .build();
        return EffectEstimation.estimated(candidate);
    }

    /**
     * Same regression with the cause column permuted. Returns null when the permuted design
     * cannot be fitted.
     */
    private PlaceboRefutation refute(String cause, double[] y, double[][] x,
                                     int degreesOfFreedom, double significanceThreshold) {
        int[] permutation = MathArrays.natural(y.length);
        MathArrays.shuffle(permutation, new Well19937c(settings.getPlaceboSeed() + 31L * cause.hashCode()));

        double[][] placebo = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            placebo[i] = x[i].clone();
            placebo[i][0] = x[permutation[i]][0];
        }

        try {
            Coefficient effect = fit(y, placebo, degreesOfFreedom);
            return PlaceboRefutation.builder()
                    .placeboEffect(effect.value())
                    .placeboPValue(effect.pValue())
                    .passed(effect.pValue() > significanceThreshold)
                    .build();
        } catch (MathIllegalArgumentException e) {
            log.debug("Placebo regression for {} failed: {}", cause, e.getMessage());
            return null;
        }
    }

    /**
     * Fits {@code y ~ x} with intercept and returns the coefficient of the first regressor.
     */
    private Coefficient fit(double[] y, double[][] x, int degreesOfFreedom) {
        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
        regression.newSampleData(y, x);
        double[] beta = regression.estimateRegressionParameters();
        double[] errors = regression.estimateRegressionParametersStandardErrors();

        double value = beta[1];
        double standardError = errors[1];
        double pValue;
        if (standardError == 0.0) {
            pValue = value == 0.0 ? 1.0 : 0.0;
        } else {
            double t = Math.abs(value / standardError);
            pValue = 2.0 * (1.0 - new TDistribution(degreesOfFreedom).cumulativeProbability(t));
        }
        return new Coefficient(value, standardError, clamp(pValue));
    }

    private static double clamp(double probability) {
        if (Double.isNaN(probability)) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, probability));
    }

    private record Coefficient(double value, double standardError, double pValue) {
    }
}
