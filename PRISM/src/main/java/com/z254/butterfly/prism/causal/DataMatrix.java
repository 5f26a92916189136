package com.z254.butterfly.prism.causal;

import com.z254.butterfly.prism.domain.model.Observation;
import com.z254.butterfly.prism.domain.store.ObservationSnapshot;
import org.apache.commons.math3.stat.StatUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Column view of an observation snapshot.
 * <p>
 * Missing values are {@link Double#NaN}. Every statistic is computed over the rows
 * that are complete for the variables it touches.
 */
public final class DataMatrix {

    private final List<String> variables;
    private final Map<String, double[]> columns;
    private final int rowCount;

    private DataMatrix(Map<String, double[]> sortedColumns, int rowCount) {
        this.variables = List.copyOf(sortedColumns.keySet());
        this.columns = Collections.unmodifiableMap(sortedColumns);
        this.rowCount = rowCount;
    }

    public static DataMatrix from(ObservationSnapshot snapshot) {
        List<Observation> observations = snapshot.getObservations();
        Map<String, double[]> columns = new TreeMap<>();
        for (String variable : snapshot.getVariables()) {
            double[] column = new double[observations.size()];
            for (int row = 0; row < column.length; row++) {
                column[row] = observations.get(row).valueOf(variable);
            }
            columns.put(variable, column);
        }
        return new DataMatrix(columns, observations.size());
    }

    /**
     * Build from raw columns; all columns must have the same length.
     */
    public static DataMatrix of(Map<String, double[]> rawColumns) {
        Map<String, double[]> columns = new TreeMap<>();
        int rows = -1;
        for (Map.Entry<String, double[]> entry : rawColumns.entrySet()) {
            if (rows >= 0 && entry.getValue().length != rows) {
                throw new IllegalArgumentException("Column " + entry.getKey() + " has "
                        + entry.getValue().length + " rows, expected " + rows);
            }
            rows = entry.getValue().length;
            columns.put(entry.getKey(), entry.getValue().clone());
        }
        return new DataMatrix(columns, Math.max(rows, 0));
    }

    public List<String> getVariables() {
        return variables;
    }

    public int getRowCount() {
        return rowCount;
    }

    public boolean hasVariable(String variable) {
        return columns.containsKey(variable);
    }

    /**
     * Indices of the rows where every given variable has a finite value.
     */
    public int[] completeRows(Collection<String> vars) {
        List<double[]> selected = new ArrayList<>(vars.size());
        for (String var : vars) {
            selected.add(require(var));
        }
        int[] buffer = new int[rowCount];
        int n = 0;
        for (int row = 0; row < rowCount; row++) {
            boolean complete = true;
            for (double[] column : selected) {
                if (!Double.isFinite(column[row])) {
                    complete = false;
                    break;
                }
            }
            if (complete) {
                buffer[n++] = row;
            }
        }
        int[] rows = new int[n];
        System.arraycopy(buffer, 0, rows, 0, n);
        return rows;
    }

    /**
     * Values of one variable at the given rows.
     */
    public double[] column(String variable, int[] rows) {
        double[] source = require(variable);
        double[] values = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            values[i] = source[rows[i]];
        }
        return values;
    }

    /**
     * Row-major sample matrix (rows x vars) for the given rows.
     */
    public double[][] sample(List<String> vars, int[] rows) {
        double[][] sample = new double[rows.length][vars.size()];
        for (int j = 0; j < vars.size(); j++) {
            double[] source = require(vars.get(j));
            for (int i = 0; i < rows.length; i++) {
                sample[i][j] = source[rows[i]];
            }
        }
        return sample;
    }

    /**
     * A variable is degenerate when it has fewer than two distinct finite values
     * (which also covers zero variance).
     */
    public boolean isDegenerate(String variable) {
        double[] values = column(variable, completeRows(List.of(variable)));
        Set<Double> distinct = new HashSet<>();
        for (double value : values) {
            distinct.add(value);
            if (distinct.size() > 1) {
                break;
            }
        }
        return distinct.size() < 2 || !(StatUtils.variance(values) > 0.0);
    }

    /**
     * Copy of this matrix with one column replaced.
     */
    public DataMatrix withColumn(String variable, double[] values) {
        if (values.length != rowCount) {
            throw new IllegalArgumentException("Expected " + rowCount + " values, got " + values.length);
        }
        Map<String, double[]> copy = new LinkedHashMap<>(columns);
        copy.put(variable, values.clone());
        return of(copy);
    }

    private double[] require(String variable) {
        double[] column = columns.get(variable);
        if (column == null) {
            throw new IllegalArgumentException("Unknown variable: " + variable);
        }
        return column;
    }
}
