package com.creditintel.backend.pipeline;

import java.util.Arrays;
import java.util.List;

/**
 * Fixed rows of raw feature values in schema order. Used as the Shapley background distribution and
 * as the evaluation set when comparing explanations across model versions.
 */
public final class ReferencePopulation {

    private final double[][] rows;

    public ReferencePopulation(List<double[]> rows) {
        this.rows = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            this.rows[i] = rows.get(i).clone();
        }
    }

    public static ReferencePopulation empty() {
        return new ReferencePopulation(List.of());
    }

    public int size() {
        return rows.length;
    }

    public boolean isEmpty() {
        return rows.length == 0;
    }

    public double value(int row, int column) {
        return rows[row][column];
    }

    public double[] row(int row) {
        return rows[row].clone();
    }

    /**
     * Mean credit score over the population, summed in row order.
     */
    public double meanScore(LogisticParameters parameters) {
        if (rows.length == 0) {
            throw new IllegalStateException("Reference population is empty");
        }
        double sum = 0.0;
        for (double[] row : rows) {
            sum += parameters.creditScore(row);
        }
        return sum / rows.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ReferencePopulation that && Arrays.deepEquals(rows, that.rows);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(rows);
    }

    @Override
    public String toString() {
        return "ReferencePopulation{size=" + rows.length + "}";
    }
}
