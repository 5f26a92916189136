package com.z254.butterfly.prism.causal;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

import java.util.ArrayList;
import java.util.List;

/**
 * Fisher-z test of the partial correlation of two variables.
 * <p>
 * The partial correlation is read off the inverse of the correlation matrix of
 * {@code (a, b, S)}; independence is declared when the two-sided p-value exceeds
 * the significance threshold.
 */
public class FisherZIndependenceTester implements IndependenceTester {

    private static final double MAX_ABS_CORRELATION = 1.0 - 1e-12;

    private final double significanceThreshold;
    private final double maxConditionNumber;
    private final NormalDistribution standardNormal = new NormalDistribution();

    public FisherZIndependenceTester(double significanceThreshold, double maxConditionNumber) {
        if (!(significanceThreshold > 0.0 && significanceThreshold < 1.0)) {
            throw new IllegalArgumentException("Significance threshold must be in (0, 1): "
                    + significanceThreshold);
        }
        this.significanceThreshold = significanceThreshold;
        this.maxConditionNumber = maxConditionNumber;
    }

    @Override
    public double getSignificanceThreshold() {
        return significanceThreshold;
    }

    @Override
    public IndependenceResult test(String a, String b, List<String> conditioningSet, DataMatrix data) {
        if (a.equals(b)) {
            throw new IllegalArgumentException("Cannot test a variable against itself: " + a);
        }
        if (conditioningSet.contains(a) || conditioningSet.contains(b)) {
            throw new IllegalArgumentException("Conditioning set " + conditioningSet
                    + " must exclude " + a + " and " + b);
        }

        // Canonical order makes test(a, b, S) and test(b, a, S) bit-identical.
        VariablePair pair = VariablePair.of(a, b);
        List<String> given = new ArrayList<>(conditioningSet);
        given.sort(null);

        List<String> vars = new ArrayList<>(given.size() + 2);
        vars.add(pair.first());
        vars.add(pair.second());
        vars.addAll(given);

        int[] rows = data.completeRows(vars);
        int n = rows.length;
        int k = given.size();
        if (n < k + 4) {
            return IndependenceResult.undecided(IndependenceResult.Status.INSUFFICIENT_DATA, n);
        }

        double[][] sample = data.sample(vars, rows);
        if (hasConstantColumn(sample, vars.size())) {
            return IndependenceResult.undecided(IndependenceResult.Status.NUMERIC_INSTABILITY, n);
        }

        RealMatrix correlation = new PearsonsCorrelation(sample).getCorrelationMatrix();
        double r;
        if (k == 0) {
            r = correlation.getEntry(0, 1);
        } else {
            RealMatrix conditioning = correlation.getSubMatrix(2, k + 1, 2, k + 1);
            double conditionNumber = new SingularValueDecomposition(conditioning).getConditionNumber();
            if (!(conditionNumber <= maxConditionNumber)) {
                return IndependenceResult.undecided(IndependenceResult.Status.NUMERIC_INSTABILITY, n);
            }
            DecompositionSolver solver = new LUDecomposition(correlation).getSolver();
            if (!solver.isNonSingular()) {
                return IndependenceResult.undecided(IndependenceResult.Status.NUMERIC_INSTABILITY, n);
            }
            RealMatrix precision = solver.getInverse();
            r = -precision.getEntry(0, 1)
                    / Math.sqrt(precision.getEntry(0, 0) * precision.getEntry(1, 1));
        }
        if (!Double.isFinite(r)) {
            return IndependenceResult.undecided(IndependenceResult.Status.NUMERIC_INSTABILITY, n);
        }

        r = Math.max(-MAX_ABS_CORRELATION, Math.min(MAX_ABS_CORRELATION, r));
        double z = 0.5 * Math.log((1.0 + r) / (1.0 - r)) * Math.sqrt(n - k - 3.0);
        double pValue = 2.0 * (1.0 - standardNormal.cumulativeProbability(Math.abs(z)));
        pValue = Math.max(0.0, Math.min(1.0, pValue));

        return IndependenceResult.builder()
                .status(IndependenceResult.Status.DECIDED)
                .independent(pValue > significanceThreshold)
                .pValue(pValue)
                .statistic(z)
                .partialCorrelation(r)
                .sampleSize(n)
                .build();
    }

    private static boolean hasConstantColumn(double[][] sample, int columns) {
        RealMatrix matrix = new Array2DRowRealMatrix(sample, false);
        for (int j = 0; j < columns; j++) {
            if (!(StatUtils.variance(matrix.getColumn(j)) > 0.0)) {
                return true;
            }
        }
        return false;
    }
}
