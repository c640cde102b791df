package com.ecoenergy.anomaly.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Output of the consensus merger: the fields of {@link AnomalyCandidate} plus the voting
 * information of the group it was built from.
 */
@Value
public class MergedAnomaly {

    LocalDateTime timestamp;
    Site site;
    Sector sector;
    /** Type of the most severe member; see {@link #getAnomalyTypes()} for the full set. */
    AnomalyType primaryType;
    Set<AnomalyType> anomalyTypes;
    Severity severity;
    double actualValue;
    double expectedValue;
    double deviationPct;
    Double zScore;
    String description;
    String recommendation;
    double potentialSavingsKwh;
    DetectionMethod detectionMethod;
    int consensus;
    double ensembleScore;
    List<DetectorKind> detectedBy;

    @Builder
    private MergedAnomaly(@NonNull LocalDateTime timestamp,
                          @NonNull Site site,
                          Sector sector,
                          @NonNull AnomalyType primaryType,
                          Set<AnomalyType> anomalyTypes,
                          @NonNull Severity severity,
                          double actualValue,
                          double expectedValue,
                          double deviationPct,
                          Double zScore,
                          String description,
                          String recommendation,
                          double potentialSavingsKwh,
                          @NonNull DetectionMethod detectionMethod,
                          int consensus,
                          double ensembleScore,
                          List<DetectorKind> detectedBy) {
        this.timestamp = timestamp;
        this.site = site;
        this.sector = sector == null ? Sector.TOTAL : sector;
        this.primaryType = primaryType;
        Set<AnomalyType> types = EnumSet.of(primaryType);
        if (anomalyTypes != null) {
            types.addAll(anomalyTypes);
        }
        this.anomalyTypes = Collections.unmodifiableSet(types);
        this.severity = severity;
        this.actualValue = actualValue;
        this.expectedValue = expectedValue;
        this.deviationPct = deviationPct;
        this.zScore = zScore;
        this.description = description == null ? "" : description;
        this.recommendation = recommendation == null ? "" : recommendation;
        this.potentialSavingsKwh = Math.max(0d, potentialSavingsKwh);
        this.detectionMethod = detectionMethod;
        this.consensus = consensus;
        this.ensembleScore = ensembleScore;
        this.detectedBy = detectedBy == null ? List.of() : List.copyOf(detectedBy);
    }

    public boolean isMultiType() {
        return anomalyTypes.size() > 1;
    }
}
