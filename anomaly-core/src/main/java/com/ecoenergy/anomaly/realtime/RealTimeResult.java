package com.ecoenergy.anomaly.realtime;

import com.ecoenergy.anomaly.model.AnomalyCandidate;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RealTimeResult {

    @Singular
    List<AnomalyCandidate> candidates;
    /** Conditions the caller should surface, e.g. a site without a fitted baseline. */
    @Singular
    List<String> warnings;

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
