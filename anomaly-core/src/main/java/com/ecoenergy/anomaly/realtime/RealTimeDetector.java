package com.ecoenergy.anomaly.realtime;

import com.ecoenergy.anomaly.baseline.Baseline;
import com.ecoenergy.anomaly.baseline.BaselineCalculator;
import com.ecoenergy.anomaly.baseline.BaselineSet;
import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.ConsumptionRecord;
import com.ecoenergy.anomaly.model.DetectionMethod;
import com.ecoenergy.anomaly.rules.RuleBasedDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Low-latency path for a single incoming reading. Uses only the cached baseline and the rules that
 * need no historical window; results bypass the consensus merger.
 */
@Slf4j
@RequiredArgsConstructor
public class RealTimeDetector {

    private final RuleBasedDetector ruleBasedDetector;

    public RealTimeResult detect(ConsumptionRecord record, BaselineSet baselines) {
        BaselineCalculator.requireFiniteTotal(record);
        Optional<Baseline> baseline = baselines.forSite(record.getSite());
        if (baseline.isEmpty()) {
            log.warn("No baseline for site {}, real-time detection skipped", record.getSite());
            return RealTimeResult.builder()
                    .warning("No fitted baseline for site " + record.getSite())
                    .build();
        }
        RealTimeResult.RealTimeResultBuilder result = RealTimeResult.builder();
        for (AnomalyCandidate candidate : ruleBasedDetector.detectRecord(record, baseline.get())) {
            result.candidate(candidate.toBuilder()
                    .detectionMethod(DetectionMethod.RULES_REALTIME)
                    .build());
        }
        RealTimeResult built = result.build();
        log.debug("Real-time site:{} ts:{} candidates:{}", record.getSite(), record.getTimestamp(), built.getCandidates().size());
        return built;
    }
}
