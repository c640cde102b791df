package com.ecoenergy.anomaly.outlier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Row-major numeric table with named columns. Row {@code i} corresponds to the {@code i}-th record
 * handed to the extractor.
 */
public final class FeatureMatrix {

    private final List<String> columns;
    private final double[][] rows;

    public FeatureMatrix(List<String> columns, double[][] rows) {
        for (double[] row : rows) {
            if (row.length != columns.size()) {
                throw new IllegalArgumentException("Row width " + row.length + " does not match " + columns.size() + " columns");
            }
        }
        this.columns = List.copyOf(columns);
        this.rows = rows;
    }

    public List<String> columns() {
        return columns;
    }

    public int rowCount() {
        return rows.length;
    }

    public int columnIndex(String column) {
        return columns.indexOf(column);
    }

    public double value(int row, String column) {
        int index = columnIndex(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return rows[row][index];
    }

    /** Copy without {@code excluded} columns; names not present are ignored. */
    public FeatureMatrix without(Collection<String> excluded) {
        List<Integer> keep = new ArrayList<>();
        List<String> kept = new ArrayList<>();
        for (int c = 0; c < columns.size(); c++) {
            if (!excluded.contains(columns.get(c))) {
                keep.add(c);
                kept.add(columns.get(c));
            }
        }
        double[][] selected = new double[rows.length][keep.size()];
        for (int r = 0; r < rows.length; r++) {
            for (int c = 0; c < keep.size(); c++) {
                selected[r][c] = rows[r][keep.get(c)];
            }
        }
        return new FeatureMatrix(kept, selected);
    }

    /** Copy of the values with NaN and infinities replaced by 0. */
    public double[][] finiteValues() {
        double[][] values = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            values[r] = rows[r].clone();
            for (int c = 0; c < values[r].length; c++) {
                if (!Double.isFinite(values[r][c])) {
                    values[r][c] = 0.0;
                }
            }
        }
        return values;
    }
}
