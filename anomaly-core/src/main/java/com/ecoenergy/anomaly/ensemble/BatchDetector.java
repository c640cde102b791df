package com.ecoenergy.anomaly.ensemble;

import com.ecoenergy.anomaly.baseline.BaselineSet;
import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.ConsumptionRecord;
import com.ecoenergy.anomaly.model.DetectorKind;
import com.ecoenergy.anomaly.model.Severity;

import java.util.List;

/**
 * Ensemble member working on a window of records. Implementations must not mutate the baselines
 * or keep state between calls.
 */
public interface BatchDetector {

    DetectorKind kind();

    /** Whether the capability this detector relies on is present in the deployment. */
    boolean available();

    List<AnomalyCandidate> detect(List<ConsumptionRecord> dataset, BaselineSet baselines, Severity minSeverity);
}
