package com.ecoenergy.anomaly.residual;

import lombok.extern.slf4j.Slf4j;

/**
 * Classical additive decomposition. The trend is a centered moving average over one period
 * (a 2xP average for even periods), held flat over the half-period at each end. Seasonal indices
 * are the per-phase means of the detrended series, normalized to sum to zero.
 */
@Slf4j
public class MovingAverageDecomposer implements SeasonalDecomposer {

    @Override
    public boolean available() {
        return true;
    }

    @Override
    public Decomposition decompose(double[] series, int period) {
        if (period < 2) {
            throw new IllegalArgumentException("Seasonal period must be at least 2, got " + period);
        }
        int n = series.length;
        if (n < period * 2) {
            log.info("Series too short for decomposition: {} < {}", n, period * 2);
            return Decomposition.identity(series);
        }
        double[] x = fillGaps(series);
        int half = period / 2;
        int first = half;
        int last = n - half - 1;

        double[] trend = new double[n];
        for (int t = first; t <= last; t++) {
            trend[t] = centeredMean(x, t, period);
        }
        for (int t = 0; t < first; t++) {
            trend[t] = trend[first];
        }
        for (int t = last + 1; t < n; t++) {
            trend[t] = trend[last];
        }

        double[] phaseSum = new double[period];
        int[] phaseCount = new int[period];
        for (int t = first; t <= last; t++) {
            phaseSum[t % period] += x[t] - trend[t];
            phaseCount[t % period]++;
        }
        double[] index = new double[period];
        double indexMean = 0.0;
        for (int p = 0; p < period; p++) {
            index[p] = phaseCount[p] > 0 ? phaseSum[p] / phaseCount[p] : 0.0;
            indexMean += index[p];
        }
        indexMean /= period;

        double[] seasonal = new double[n];
        double[] residual = new double[n];
        for (int t = 0; t < n; t++) {
            seasonal[t] = index[t % period] - indexMean;
            residual[t] = x[t] - trend[t] - seasonal[t];
        }
        return new Decomposition(trend, seasonal, residual);
    }

    private static double centeredMean(double[] x, int t, int period) {
        int half = period / 2;
        double sum = 0.0;
        if (period % 2 == 0) {
            sum += 0.5 * x[t - half] + 0.5 * x[t + half];
            for (int k = -half + 1; k <= half - 1; k++) {
                sum += x[t + k];
            }
        } else {
            for (int k = -half; k <= half; k++) {
                sum += x[t + k];
            }
        }
        return sum / period;
    }

    /** Linear interpolation over NaN gaps, then nearest value at the edges. */
    static double[] fillGaps(double[] series) {
        double[] x = series.clone();
        int n = x.length;
        int prev = -1;
        for (int i = 0; i < n; i++) {
            if (Double.isFinite(x[i])) {
                if (prev >= 0 && i - prev > 1) {
                    double step = (x[i] - x[prev]) / (i - prev);
                    for (int j = prev + 1; j < i; j++) {
                        x[j] = x[prev] + step * (j - prev);
                    }
                }
                prev = i;
            }
        }
        if (prev < 0) {
            return new double[n];
        }
        int firstFinite = 0;
        while (!Double.isFinite(x[firstFinite])) firstFinite++;
        for (int i = 0; i < firstFinite; i++) x[i] = x[firstFinite];
        for (int i = prev + 1; i < n; i++) x[i] = x[prev];
        return x;
    }
}
