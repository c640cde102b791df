package com.ecoenergy.anomaly.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Anomaly proposed by a single detector.
 */
@Value
public class AnomalyCandidate {

    LocalDateTime timestamp;
    Site site;
    Sector sector;
    AnomalyType anomalyType;
    Severity severity;
    double actualValue;
    double expectedValue;
    double deviationPct;
    Double zScore;
    String description;
    String recommendation;
    /** Never negative: readings under the expected value save nothing. */
    double potentialSavingsKwh;
    DetectionMethod detectionMethod;
    Map<String, Double> context;

    @Builder(toBuilder = true)
    private AnomalyCandidate(@NonNull LocalDateTime timestamp,
                             @NonNull Site site,
                             Sector sector,
                             @NonNull AnomalyType anomalyType,
                             @NonNull Severity severity,
                             double actualValue,
                             double expectedValue,
                             double deviationPct,
                             Double zScore,
                             String description,
                             String recommendation,
                             double potentialSavingsKwh,
                             @NonNull DetectionMethod detectionMethod,
                             Map<String, Double> context) {
        this.timestamp = timestamp;
        this.site = site;
        this.sector = sector == null ? Sector.TOTAL : sector;
        this.anomalyType = anomalyType;
        this.severity = severity;
        this.actualValue = actualValue;
        this.expectedValue = expectedValue;
        this.deviationPct = deviationPct;
        this.zScore = zScore;
        this.description = description == null ? "" : description;
        this.recommendation = recommendation == null ? "" : recommendation;
        this.potentialSavingsKwh = Math.max(0d, potentialSavingsKwh);
        this.detectionMethod = detectionMethod;
        this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static double savings(double actual, double expected) {
        return Math.max(0d, actual - expected);
    }
}
