package com.ecoenergy.anomaly.ensemble;

import com.ecoenergy.anomaly.baseline.Stats;
import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.DetectionMethod;
import com.ecoenergy.anomaly.model.DetectorKind;
import com.ecoenergy.anomaly.model.MergedAnomaly;
import com.ecoenergy.anomaly.model.Sector;
import com.ecoenergy.anomaly.model.Severity;
import com.ecoenergy.anomaly.model.Site;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Groups candidates from all detectors by (site, hour) and keeps the buckets enough distinct
 * detectors agree on.
 */
@Slf4j
public class ConsensusMerger {

    static final Comparator<MergedAnomaly> ORDER = Comparator
            .comparing(MergedAnomaly::getTimestamp)
            .thenComparing(MergedAnomaly::getSeverity, Comparator.reverseOrder())
            .thenComparing(MergedAnomaly::getSite)
            .thenComparing(MergedAnomaly::getPrimaryType);

    private final MergerConfig config;

    public ConsensusMerger(MergerConfig config) {
        this.config = config.validate();
    }

    public ConsensusMerger() {
        this(MergerConfig.defaults());
    }

    public List<MergedAnomaly> merge(Map<DetectorKind, List<AnomalyCandidate>> candidatesByDetector) {
        Map<BucketKey, List<Vote>> buckets = new LinkedHashMap<>();
        candidatesByDetector.forEach((kind, candidates) -> {
            for (AnomalyCandidate candidate : candidates) {
                BucketKey key = new BucketKey(candidate.getSite(), candidate.getTimestamp().truncatedTo(ChronoUnit.HOURS));
                buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(new Vote(kind, candidate));
            }
        });

        List<MergedAnomaly> merged = new ArrayList<>();
        buckets.forEach((key, votes) -> {
            Set<DetectorKind> detectors = votes.stream()
                    .map(Vote::detector)
                    .collect(Collectors.toCollection(() -> EnumSet.noneOf(DetectorKind.class)));
            int consensus = detectors.size();
            if (consensus >= config.getMinConsensus() && consensus > 1) {
                merged.add(combine(key, votes, detectors));
            } else if (consensus == 1 && config.getMinConsensus() == 1) {
                votes.forEach(vote -> merged.add(single(vote)));
            }
        });
        merged.sort(ORDER);
        log.debug("Merged {} buckets into {} anomalies (min consensus {})", buckets.size(), merged.size(), config.getMinConsensus());
        return merged;
    }

    public MergerConfig config() {
        return config;
    }

    private MergedAnomaly combine(BucketKey key, List<Vote> votes, Set<DetectorKind> detectors) {
        AnomalyCandidate mostSevere = votes.get(0).candidate();
        Set<AnomalyType> types = EnumSet.noneOf(AnomalyType.class);
        double[] actual = new double[votes.size()];
        double[] expected = new double[votes.size()];
        double[] deviation = new double[votes.size()];
        for (int i = 0; i < votes.size(); i++) {
            AnomalyCandidate candidate = votes.get(i).candidate();
            if (candidate.getSeverity().ordinal() > mostSevere.getSeverity().ordinal()) {
                mostSevere = candidate;
            }
            types.add(candidate.getAnomalyType());
            actual[i] = candidate.getActualValue();
            expected[i] = candidate.getExpectedValue();
            deviation[i] = candidate.getDeviationPct();
        }
        double meanActual = Stats.mean(actual);
        double meanExpected = Stats.mean(expected);
        double score = detectors.stream().mapToDouble(config::weightOf).sum();
        String names = detectors.stream().map(DetectorKind::getDetectorName).collect(Collectors.joining(", "));

        return MergedAnomaly.builder()
                .timestamp(key.hour())
                .site(key.site())
                .sector(Sector.TOTAL)
                .primaryType(mostSevere.getAnomalyType())
                .anomalyTypes(types)
                .severity(mostSevere.getSeverity())
                .actualValue(meanActual)
                .expectedValue(meanExpected)
                .deviationPct(Stats.mean(deviation))
                .description("Anomaly detected by " + detectors.size() + " methods: " + names)
                .recommendation(mostSevere.getRecommendation())
                .potentialSavingsKwh(AnomalyCandidate.savings(meanActual, meanExpected))
                .detectionMethod(DetectionMethod.ENSEMBLE)
                .consensus(detectors.size())
                .ensembleScore(score)
                .detectedBy(new ArrayList<>(detectors))
                .build();
    }

    private MergedAnomaly single(Vote vote) {
        AnomalyCandidate candidate = vote.candidate();
        return MergedAnomaly.builder()
                .timestamp(candidate.getTimestamp())
                .site(candidate.getSite())
                .sector(candidate.getSector())
                .primaryType(candidate.getAnomalyType())
                .severity(candidate.getSeverity())
                .actualValue(candidate.getActualValue())
                .expectedValue(candidate.getExpectedValue())
                .deviationPct(candidate.getDeviationPct())
                .zScore(candidate.getZScore())
                .description(candidate.getDescription())
                .recommendation(candidate.getRecommendation())
                .potentialSavingsKwh(candidate.getPotentialSavingsKwh())
                .detectionMethod(candidate.getDetectionMethod())
                .consensus(1)
                .ensembleScore(config.weightOf(vote.detector()))
                .detectedBy(List.of(vote.detector()))
                .build();
    }

    private record BucketKey(Site site, LocalDateTime hour) {
    }

    private record Vote(DetectorKind detector, AnomalyCandidate candidate) {
    }
}
