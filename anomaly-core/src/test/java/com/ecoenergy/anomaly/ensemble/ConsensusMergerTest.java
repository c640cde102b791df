package com.ecoenergy.anomaly.ensemble;

import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.DetectionMethod;
import com.ecoenergy.anomaly.model.DetectorKind;
import com.ecoenergy.anomaly.model.MergedAnomaly;
import com.ecoenergy.anomaly.model.Severity;
import com.ecoenergy.anomaly.model.Site;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.ecoenergy.anomaly.TestRecords.DUITAMA;
import static com.ecoenergy.anomaly.TestRecords.TUNJA;
import static com.ecoenergy.anomaly.TestRecords.WEDNESDAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ConsensusMergerTest {

    private static final LocalDateTime TWO_AM = WEDNESDAY.withHour(2);

    private final ConsensusMerger merger = new ConsensusMerger();

    @Test
    void agreeingDetectorsAreMergedWithMaxSeverity() {
        Map<DetectorKind, List<AnomalyCandidate>> input = new EnumMap<>(DetectorKind.class);
        input.put(DetectorKind.RULES, List.of(candidate(TUNJA, TWO_AM.withMinute(0), AnomalyType.OFF_HOURS, Severity.MEDIUM, 80, 20)));
        input.put(DetectorKind.RESIDUAL, List.of(candidate(TUNJA, TWO_AM.withMinute(40), AnomalyType.RESIDUAL_SPIKE, Severity.CRITICAL, 90, 40)));

        List<MergedAnomaly> merged = merger.merge(input);

        assertThat(merged).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.getTimestamp()).isEqualTo(TWO_AM);
            assertThat(anomaly.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(anomaly.getPrimaryType()).isEqualTo(AnomalyType.RESIDUAL_SPIKE);
            assertThat(anomaly.getConsensus()).isEqualTo(2);
            assertThat(anomaly.getAnomalyTypes()).containsExactlyInAnyOrder(AnomalyType.OFF_HOURS, AnomalyType.RESIDUAL_SPIKE);
            assertThat(anomaly.getActualValue()).isEqualTo(85.0);
            assertThat(anomaly.getExpectedValue()).isEqualTo(30.0);
            assertThat(anomaly.getPotentialSavingsKwh()).isEqualTo(55.0);
            assertThat(anomaly.getEnsembleScore()).isCloseTo(0.7, within(1e-9));
            assertThat(anomaly.getDetectedBy()).containsExactly(DetectorKind.RULES, DetectorKind.RESIDUAL);
            assertThat(anomaly.getDetectionMethod()).isEqualTo(DetectionMethod.ENSEMBLE);
            assertThat(anomaly.getDescription()).isEqualTo("Anomaly detected by 2 methods: rules, residual");
            assertThat(anomaly.getRecommendation()).isEqualTo("recommendation for residual_spike");
            assertThat(anomaly.isMultiType()).isTrue();
        });
    }

    @Test
    void singleDetectorBucketIsDroppedAtDefaultConsensus() {
        Map<DetectorKind, List<AnomalyCandidate>> input = Map.of(
                DetectorKind.RULES, List.of(
                        candidate(TUNJA, TWO_AM, AnomalyType.OFF_HOURS, Severity.CRITICAL, 80, 20),
                        candidate(TUNJA, TWO_AM, AnomalyType.SPIKE, Severity.CRITICAL, 80, 20)),
                DetectorKind.RESIDUAL, List.of());

        assertThat(merger.merge(input)).isEmpty();
    }

    @Test
    void scoreCountsEachDetectorOnce() {
        Map<DetectorKind, List<AnomalyCandidate>> input = new EnumMap<>(DetectorKind.class);
        input.put(DetectorKind.RULES, List.of(
                candidate(TUNJA, TWO_AM, AnomalyType.OFF_HOURS, Severity.HIGH, 80, 20),
                candidate(TUNJA, TWO_AM, AnomalyType.SPIKE, Severity.HIGH, 80, 20)));
        input.put(DetectorKind.OUTLIER_MODEL, List.of(
                candidate(TUNJA, TWO_AM, AnomalyType.STATISTICAL_OUTLIER, Severity.LOW, 80, 50)));

        MergedAnomaly merged = merger.merge(input).get(0);

        assertThat(merged.getConsensus()).isEqualTo(2);
        assertThat(merged.getEnsembleScore()).isCloseTo(0.7, within(1e-9));
        assertThat(merged.getExpectedValue()).isEqualTo(30.0);
    }

    @Test
    void threeDetectorsOnOneBucket() {
        Map<DetectorKind, List<AnomalyCandidate>> input = new EnumMap<>(DetectorKind.class);
        input.put(DetectorKind.RULES, List.of(candidate(TUNJA, TWO_AM, AnomalyType.OFF_HOURS, Severity.HIGH, 80, 20)));
        input.put(DetectorKind.RESIDUAL, List.of(candidate(TUNJA, TWO_AM, AnomalyType.RESIDUAL_SPIKE, Severity.MEDIUM, 80, 30)));
        input.put(DetectorKind.OUTLIER_MODEL, List.of(candidate(TUNJA, TWO_AM, AnomalyType.STATISTICAL_OUTLIER, Severity.LOW, 80, 40)));

        MergedAnomaly merged = merger.merge(input).get(0);

        assertThat(merged.getConsensus()).isEqualTo(3);
        assertThat(merged.getAnomalyTypes()).hasSize(3);
        assertThat(merged.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(merged.getEnsembleScore()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void bucketsAreKeyedBySiteAndHour() {
        Map<DetectorKind, List<AnomalyCandidate>> input = new EnumMap<>(DetectorKind.class);
        input.put(DetectorKind.RULES, List.of(
                candidate(TUNJA, TWO_AM, AnomalyType.OFF_HOURS, Severity.HIGH, 80, 20),
                candidate(DUITAMA, TWO_AM, AnomalyType.OFF_HOURS, Severity.HIGH, 80, 20)));
        input.put(DetectorKind.RESIDUAL, List.of(
                candidate(TUNJA, TWO_AM.plusHours(1), AnomalyType.RESIDUAL_SPIKE, Severity.HIGH, 80, 20),
                candidate(DUITAMA, TWO_AM.plusMinutes(59), AnomalyType.RESIDUAL_SPIKE, Severity.HIGH, 80, 20)));

        assertThat(merger.merge(input)).extracting(MergedAnomaly::getSite).containsExactly(DUITAMA);
    }

    @Test
    void minConsensusOnePassesSingletonsThrough() {
        ConsensusMerger lenient = new ConsensusMerger(MergerConfig.builder().minConsensus(1).build());
        AnomalyCandidate single = candidate(TUNJA, TWO_AM.withMinute(15), AnomalyType.OFF_HOURS, Severity.LOW, 80, 20);

        List<MergedAnomaly> merged = lenient.merge(Map.of(DetectorKind.RULES, List.of(single)));

        assertThat(merged).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.getConsensus()).isEqualTo(1);
            assertThat(anomaly.getTimestamp()).isEqualTo(single.getTimestamp());
            assertThat(anomaly.getDetectionMethod()).isEqualTo(DetectionMethod.RULES);
            assertThat(anomaly.getEnsembleScore()).isCloseTo(0.4, within(1e-9));
            assertThat(anomaly.getAnomalyTypes()).containsExactly(AnomalyType.OFF_HOURS);
        });
    }

    @Test
    void orderedByTimeThenDescendingSeverity() {
        ConsensusMerger lenient = new ConsensusMerger(MergerConfig.builder().minConsensus(1).build());
        Map<DetectorKind, List<AnomalyCandidate>> input = Map.of(DetectorKind.RULES, List.of(
                candidate(TUNJA, TWO_AM.plusHours(1), AnomalyType.OFF_HOURS, Severity.CRITICAL, 80, 20),
                candidate(TUNJA, TWO_AM, AnomalyType.OFF_HOURS, Severity.LOW, 80, 20),
                candidate(TUNJA, TWO_AM, AnomalyType.SPIKE, Severity.HIGH, 80, 20)));

        assertThat(lenient.merge(input)).extracting(MergedAnomaly::getSeverity)
                .containsExactly(Severity.HIGH, Severity.LOW, Severity.CRITICAL);
    }

    @Test
    void unknownWeightUsesTheDefault() {
        MergerConfig config = MergerConfig.builder().weights(Map.of(DetectorKind.RULES, 0.5)).build();

        assertThat(config.weightOf(DetectorKind.RESIDUAL)).isEqualTo(MergerConfig.DEFAULT_WEIGHT);
    }

    @Test
    void invalidConfigurationIsRejected() {
        assertThatThrownBy(() -> new ConsensusMerger(MergerConfig.builder().minConsensus(0).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConsensusMerger(MergerConfig.builder().weights(Map.of(DetectorKind.RULES, -1.0)).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mergingIsRepeatable() {
        Map<DetectorKind, List<AnomalyCandidate>> input = new EnumMap<>(DetectorKind.class);
        input.put(DetectorKind.RULES, List.of(candidate(TUNJA, TWO_AM, AnomalyType.OFF_HOURS, Severity.HIGH, 80, 20)));
        input.put(DetectorKind.RESIDUAL, List.of(candidate(TUNJA, TWO_AM, AnomalyType.RESIDUAL_SPIKE, Severity.LOW, 80, 30)));

        assertThat(merger.merge(input)).isEqualTo(merger.merge(input));
    }

    static AnomalyCandidate candidate(Site site, LocalDateTime timestamp, AnomalyType type, Severity severity,
                                      double actual, double expected) {
        return AnomalyCandidate.builder()
                .site(site)
                .timestamp(timestamp)
                .anomalyType(type)
                .severity(severity)
                .actualValue(actual)
                .expectedValue(expected)
                .deviationPct((actual - expected) / expected * 100)
                .recommendation("recommendation for " + type.getCode())
                .potentialSavingsKwh(AnomalyCandidate.savings(actual, expected))
                .detectionMethod(DetectionMethod.RULES)
                .build();
    }
}
