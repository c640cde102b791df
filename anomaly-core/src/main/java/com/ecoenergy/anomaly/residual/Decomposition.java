package com.ecoenergy.anomaly.residual;

/**
 * Additive components of a series: {@code series[i] == trend[i] + seasonal[i] + residual[i]}.
 */
public final class Decomposition {

    private final double[] trend;
    private final double[] seasonal;
    private final double[] residual;
    private final boolean identity;
    private final int length;

    public Decomposition(double[] trend, double[] seasonal, double[] residual) {
        this(trend, seasonal, residual, false);
    }

    private Decomposition(double[] trend, double[] seasonal, double[] residual, boolean identity) {
        if (trend.length != seasonal.length || trend.length != residual.length) {
            throw new IllegalArgumentException("Components must have the same length");
        }
        this.trend = trend.clone();
        this.seasonal = seasonal.clone();
        this.residual = residual.clone();
        this.identity = identity;
        this.length = trend.length;
    }

    /** Fallback when no decomposition is possible: the whole series is trend. */
    public static Decomposition identity(double[] series) {
        return new Decomposition(series, new double[series.length], new double[series.length], true);
    }

    public double[] getTrend() {
        return trend.clone();
    }

    public double[] getSeasonal() {
        return seasonal.clone();
    }

    public double[] getResidual() {
        return residual.clone();
    }

    public double trendAt(int i) {
        return trend[i];
    }

    public double seasonalAt(int i) {
        return seasonal[i];
    }

    public double residualAt(int i) {
        return residual[i];
    }

    /** Trend plus seasonal, i.e. what the series "should" have been at {@code i}. */
    public double expectedAt(int i) {
        return trend[i] + seasonal[i];
    }

    public int size() {
        return length;
    }

    /** True for the fallback produced when the series was too short to decompose. */
    public boolean isIdentity() {
        return identity;
    }
}
