package com.ecoenergy.anomaly.baseline;

import java.util.Arrays;
import java.util.List;

/**
 * Descriptive statistics over plain value lists. Empty input yields 0 rather than NaN.
 */
public final class Stats {

    private Stats() {
    }

    public static double mean(double[] xs) {
        if (xs.length == 0) return 0.0;
        double s = 0.0;
        for (double v : xs) s += v;
        return s / xs.length;
    }

    public static double mean(List<Double> xs) {
        return mean(toArray(xs));
    }

    /** Sample standard deviation (n - 1). Fewer than two values give 0. */
    public static double std(double[] xs) {
        if (xs.length <= 1) return 0.0;
        double mean = mean(xs);
        double s2 = 0.0;
        for (double v : xs) {
            double d = v - mean;
            s2 += d * d;
        }
        double std = Math.sqrt(s2 / (xs.length - 1));
        // rounding noise on a constant series
        return std < 1e-12 * Math.max(1.0, Math.abs(mean)) ? 0.0 : std;
    }

    public static double std(List<Double> xs) {
        return std(toArray(xs));
    }

    public static double median(double[] xs) {
        return percentile(xs, 50);
    }

    /** Percentile with linear interpolation between the closest ranks. */
    public static double percentile(double[] xs, double percentile) {
        if (xs.length == 0) return 0.0;
        double[] sorted = xs.clone();
        Arrays.sort(sorted);
        double index = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = index - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    public static double[] toArray(List<Double> xs) {
        double[] values = new double[xs.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = xs.get(i);
        }
        return values;
    }
}
