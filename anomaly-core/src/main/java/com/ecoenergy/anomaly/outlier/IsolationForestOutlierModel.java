package com.ecoenergy.anomaly.outlier;

import lombok.extern.slf4j.Slf4j;
import smile.anomaly.IsolationForest;

import java.util.Objects;

/**
 * {@link OutlierModel} over a Smile {@link IsolationForest}. Smile scores grow with abnormality and sit
 * around 0.5 for ordinary points, so the signed score is {@code threshold - score}.
 */
@Slf4j
public class IsolationForestOutlierModel implements OutlierModel {

    public static final double DEFAULT_DECISION_THRESHOLD = 0.6;

    private final IsolationForest forest;
    private final double decisionThreshold;

    public IsolationForestOutlierModel(IsolationForest forest, double decisionThreshold) {
        this.forest = Objects.requireNonNull(forest, "forest");
        if (decisionThreshold <= 0 || decisionThreshold >= 1) {
            throw new IllegalArgumentException("Decision threshold must be in (0, 1): " + decisionThreshold);
        }
        this.decisionThreshold = decisionThreshold;
    }

    public IsolationForestOutlierModel(IsolationForest forest) {
        this(forest, DEFAULT_DECISION_THRESHOLD);
    }

    @Override
    public boolean[] predict(double[][] features) {
        double[] scores = rawScores(features);
        boolean[] outliers = new boolean[scores.length];
        for (int i = 0; i < scores.length; i++) {
            outliers[i] = scores[i] >= decisionThreshold;
        }
        return outliers;
    }

    @Override
    public double[] anomalyScore(double[][] features) {
        double[] scores = rawScores(features);
        double[] margins = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            margins[i] = decisionThreshold - scores[i];
        }
        return margins;
    }

    public double decisionThreshold() {
        return decisionThreshold;
    }

    private double[] rawScores(double[][] features) {
        double[] scores = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            scores[i] = forest.score(features[i]);
        }
        log.debug("iForest scored {} rows", scores.length);
        return scores;
    }
}
