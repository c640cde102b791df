package com.ecoenergy.anomaly.ensemble;

import com.ecoenergy.anomaly.model.DetectorKind;
import com.ecoenergy.anomaly.model.MergedAnomaly;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class EnsembleResult {

    @Singular
    List<MergedAnomaly> anomalies;
    /** Raw candidate count per detector that ran, before merging. */
    @Singular
    Map<DetectorKind, Integer> candidateCounts;
    /** Selected detectors that were unavailable or failed. */
    @Singular
    List<DetectorKind> degradedDetectors;

    public boolean isDegraded() {
        return !degradedDetectors.isEmpty();
    }
}
