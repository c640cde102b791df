package com.ecoenergy.anomaly.residual;

/**
 * Splits a regularly sampled series into trend, seasonal and residual parts.
 */
public interface SeasonalDecomposer {

    /** False when the decomposition capability is not installed in this deployment. */
    boolean available();

    /**
     * Decomposes {@code series} under a fixed seasonal {@code period}. Series shorter than two full
     * periods come back as {@link Decomposition#identity(double[])}.
     */
    Decomposition decompose(double[] series, int period);
}
