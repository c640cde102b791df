package com.ecoenergy.anomaly.ensemble;

import com.ecoenergy.anomaly.baseline.BaselineCalculator;
import com.ecoenergy.anomaly.baseline.BaselineSet;
import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.ConsumptionRecord;
import com.ecoenergy.anomaly.model.DetectorKind;
import com.ecoenergy.anomaly.model.MergedAnomaly;
import com.ecoenergy.anomaly.model.Severity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs the selected batch detectors side by side and merges their candidates. A detector that throws
 * is logged and counted as degraded; the others still contribute.
 */
@Slf4j
public class EnsembleAnomalyDetector {

    private final DetectorRegistry registry;
    private final ConsensusMerger merger;
    private final Executor executor;

    public EnsembleAnomalyDetector(DetectorRegistry registry, ConsensusMerger merger, Executor executor) {
        this.registry = registry;
        this.merger = merger;
        this.executor = executor;
    }

    public EnsembleResult detect(List<ConsumptionRecord> dataset, BaselineSet baselines, Severity minSeverity) {
        return detect(dataset, baselines, minSeverity, EnumSet.allOf(DetectorKind.class));
    }

    /**
     * @param selected detectors to run; null or empty means all of them
     */
    public EnsembleResult detect(List<ConsumptionRecord> dataset, BaselineSet baselines, Severity minSeverity,
                                 Set<DetectorKind> selected) {
        Set<DetectorKind> wanted = selected == null || selected.isEmpty()
                ? EnumSet.allOf(DetectorKind.class)
                : EnumSet.copyOf(selected);
        BaselineCalculator.requireValidRecords(dataset);
        log.info("---Start ensemble detection over {} records, detectors:{} minSeverity:{}", dataset.size(), wanted, minSeverity);

        EnsembleResult.EnsembleResultBuilder result = EnsembleResult.builder();
        List<CompletableFuture<Outcome>> futures = new ArrayList<>();
        Set<DetectorKind> running = EnumSet.noneOf(DetectorKind.class);
        for (BatchDetector detector : registry.active()) {
            if (wanted.contains(detector.kind())) {
                running.add(detector.kind());
                futures.add(CompletableFuture.supplyAsync(() -> run(detector, dataset, baselines, minSeverity), executor));
            }
        }
        for (DetectorKind kind : wanted) {
            if (!running.contains(kind)) {
                result.degradedDetector(kind);
            }
        }

        Map<DetectorKind, List<AnomalyCandidate>> candidates = new EnumMap<>(DetectorKind.class);
        for (CompletableFuture<Outcome> future : futures) {
            Outcome outcome = future.join();
            candidates.put(outcome.kind(), outcome.candidates());
            result.candidateCount(outcome.kind(), outcome.candidates().size());
            if (outcome.failed()) {
                result.degradedDetector(outcome.kind());
            }
        }

        List<MergedAnomaly> merged = merger.merge(candidates);
        result.anomalies(merged);
        log.info("Ensemble detected {} anomalies after merging", merged.size());
        return result.build();
    }

    private static Outcome run(BatchDetector detector, List<ConsumptionRecord> dataset, BaselineSet baselines, Severity minSeverity) {
        String name = detector.kind().getDetectorName();
        try {
            List<AnomalyCandidate> found = detector.detect(dataset, baselines, minSeverity);
            log.info("{}: {} anomalies", name, found.size());
            return new Outcome(detector.kind(), found, false);
        } catch (RuntimeException e) {
            log.error("Detector {} failed, continuing without it: {}", name, e.getMessage(), e);
            return new Outcome(detector.kind(), List.of(), true);
        }
    }

    private record Outcome(DetectorKind kind, List<AnomalyCandidate> candidates, boolean failed) {
    }
}
