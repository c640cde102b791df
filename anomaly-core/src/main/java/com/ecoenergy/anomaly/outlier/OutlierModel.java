package com.ecoenergy.anomaly.outlier;

/**
 * Pretrained outlier scorer. Rows are feature vectors in the column order the model was trained on.
 */
public interface OutlierModel {

    /** {@code true} marks an outlier. */
    boolean[] predict(double[][] features);

    /** Signed score per row; negative is more anomalous. */
    double[] anomalyScore(double[][] features);
}
