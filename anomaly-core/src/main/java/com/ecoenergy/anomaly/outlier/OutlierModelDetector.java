package com.ecoenergy.anomaly.outlier;

import com.ecoenergy.anomaly.baseline.BaselineCalculator;
import com.ecoenergy.anomaly.baseline.BaselineSet;
import com.ecoenergy.anomaly.baseline.Stats;
import com.ecoenergy.anomaly.ensemble.BatchDetector;
import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.ConsumptionRecord;
import com.ecoenergy.anomaly.model.DetectionMethod;
import com.ecoenergy.anomaly.model.DetectorKind;
import com.ecoenergy.anomaly.model.Sector;
import com.ecoenergy.anomaly.model.Severity;
import com.ecoenergy.anomaly.model.Site;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Adapts a pretrained {@link OutlierModel} to the ensemble. With no model loaded the detector reports
 * itself unavailable and returns nothing.
 */
@Slf4j
public class OutlierModelDetector implements BatchDetector {

    public static final String SCORE_CONTEXT_KEY = "model_score";

    private final OutlierModel model;
    private final FeatureExtractor featureExtractor;
    private final OutlierConfig config;

    /** {@code model} may be null when no trained model is deployed. */
    public OutlierModelDetector(OutlierModel model, FeatureExtractor featureExtractor, OutlierConfig config) {
        this.model = model;
        this.featureExtractor = featureExtractor;
        this.config = config.validate();
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.OUTLIER_MODEL;
    }

    @Override
    public boolean available() {
        return model != null;
    }

    @Override
    public List<AnomalyCandidate> detect(List<ConsumptionRecord> dataset, BaselineSet baselines, Severity minSeverity) {
        if (!available()) {
            log.warn("Outlier model not loaded, skipping outlier detection");
            return List.of();
        }
        if (dataset.isEmpty()) {
            return List.of();
        }
        BaselineCalculator.requireValidRecords(dataset);
        double[][] features = featureExtractor.extract(dataset)
                .without(config.getExcludedColumns())
                .finiteValues();
        boolean[] outliers = model.predict(features);
        double[] scores = model.anomalyScore(features);
        Map<Site, Double> siteMeans = siteMeans(dataset);

        List<AnomalyCandidate> anomalies = new ArrayList<>();
        for (int i = 0; i < dataset.size(); i++) {
            if (!outliers[i]) {
                continue;
            }
            Severity severity = severityOf(scores[i]);
            if (!severity.atLeast(minSeverity)) {
                continue;
            }
            ConsumptionRecord record = dataset.get(i);
            double actual = record.getTotalEnergyKwh();
            double expected = siteMeans.get(record.getSite());
            anomalies.add(AnomalyCandidate.builder()
                    .timestamp(record.getTimestamp())
                    .site(record.getSite())
                    .sector(Sector.TOTAL)
                    .anomalyType(AnomalyType.STATISTICAL_OUTLIER)
                    .severity(severity)
                    .actualValue(actual)
                    .expectedValue(expected)
                    .deviationPct(expected > 0 ? (actual - expected) / expected * 100 : 0)
                    .description(String.format(Locale.ROOT,
                            "Atypical consumption pattern detected (model score: %.3f)", scores[i]))
                    .recommendation("Review the operating conditions of this period.")
                    .potentialSavingsKwh(AnomalyCandidate.savings(actual, expected))
                    .detectionMethod(DetectionMethod.OUTLIER_MODEL)
                    .context(Map.of(SCORE_CONTEXT_KEY, scores[i]))
                    .build());
        }
        log.info("Outlier model detected {} anomalies", anomalies.size());
        return anomalies;
    }

    Severity severityOf(double score) {
        double magnitude = Math.abs(score);
        if (magnitude >= config.getCriticalCutoff()) return Severity.CRITICAL;
        if (magnitude >= config.getHighCutoff()) return Severity.HIGH;
        if (magnitude >= config.getMediumCutoff()) return Severity.MEDIUM;
        return Severity.LOW;
    }

    private static Map<Site, Double> siteMeans(List<ConsumptionRecord> dataset) {
        Map<Site, List<Double>> totals = new HashMap<>();
        for (ConsumptionRecord record : dataset) {
            totals.computeIfAbsent(record.getSite(), k -> new ArrayList<>()).add(record.getTotalEnergyKwh());
        }
        Map<Site, Double> means = new HashMap<>();
        totals.forEach((site, values) -> means.put(site, Stats.mean(values)));
        return means;
    }
}
