package com.ecoenergy.anomaly.ensemble;

import com.ecoenergy.anomaly.InvalidDatasetException;
import com.ecoenergy.anomaly.TestRecords;
import com.ecoenergy.anomaly.baseline.BaselineCalculator;
import com.ecoenergy.anomaly.baseline.BaselineSet;
import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.ConsumptionRecord;
import com.ecoenergy.anomaly.model.DetectorKind;
import com.ecoenergy.anomaly.model.MergedAnomaly;
import com.ecoenergy.anomaly.model.Severity;
import com.ecoenergy.anomaly.residual.SeasonalResidualDetector;
import com.ecoenergy.anomaly.rules.RuleBasedDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.ecoenergy.anomaly.TestRecords.TUNJA;
import static com.ecoenergy.anomaly.TestRecords.WEDNESDAY;
import static com.ecoenergy.anomaly.ensemble.ConsensusMergerTest.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EnsembleAnomalyDetectorTest {

    private static final LocalDateTime TWO_AM = WEDNESDAY.withHour(2);

    @Mock
    private BatchDetector rules;
    @Mock
    private BatchDetector residual;
    @Mock
    private BatchDetector outlier;

    private final List<ConsumptionRecord> dataset = List.of(TestRecords.record(TUNJA, TWO_AM, 80));

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(rules.kind()).thenReturn(DetectorKind.RULES);
        when(residual.kind()).thenReturn(DetectorKind.RESIDUAL);
        when(outlier.kind()).thenReturn(DetectorKind.OUTLIER_MODEL);
        when(rules.available()).thenReturn(true);
        when(residual.available()).thenReturn(true);
        when(rules.detect(any(), any(), any())).thenReturn(List.of(
                candidate(TUNJA, TWO_AM, AnomalyType.OFF_HOURS, Severity.HIGH, 80, 20)));
        when(residual.detect(any(), any(), any())).thenReturn(List.of(
                candidate(TUNJA, TWO_AM, AnomalyType.RESIDUAL_SPIKE, Severity.MEDIUM, 80, 40)));
    }

    @Test
    void unavailableDetectorDegradesTheRunWithoutFailingIt() {
        EnsembleAnomalyDetector ensemble = ensemble(Runnable::run);

        EnsembleResult result = ensemble.detect(dataset, BaselineSet.empty(), Severity.LOW);

        assertThat(result.getAnomalies()).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.getConsensus()).isEqualTo(2);
            assertThat(anomaly.getSeverity()).isEqualTo(Severity.HIGH);
        });
        assertThat(result.getDegradedDetectors()).containsExactly(DetectorKind.OUTLIER_MODEL);
        assertThat(result.getCandidateCounts())
                .containsEntry(DetectorKind.RULES, 1)
                .containsEntry(DetectorKind.RESIDUAL, 1)
                .doesNotContainKey(DetectorKind.OUTLIER_MODEL);
        verify(outlier, never()).detect(any(), any(), any());
    }

    @Test
    void failingDetectorContributesNothing() {
        when(residual.detect(any(), any(), any())).thenThrow(new IllegalStateException("decomposition blew up"));
        EnsembleAnomalyDetector ensemble = ensemble(Runnable::run);

        EnsembleResult result = ensemble.detect(dataset, BaselineSet.empty(), null);

        assertThat(result.getAnomalies()).isEmpty();
        assertThat(result.getDegradedDetectors()).contains(DetectorKind.RESIDUAL);
        assertThat(result.getCandidateCounts()).containsEntry(DetectorKind.RESIDUAL, 0);
        assertThat(result.isDegraded()).isTrue();
    }

    @Test
    void onlySelectedDetectorsRun() {
        EnsembleAnomalyDetector ensemble = ensemble(Runnable::run);

        EnsembleResult result = ensemble.detect(dataset, BaselineSet.empty(), null, EnumSet.of(DetectorKind.RULES));

        assertThat(result.getAnomalies()).isEmpty();
        assertThat(result.isDegraded()).isFalse();
        verify(residual, never()).detect(any(), any(), any());
    }

    @Test
    void detectorsRunOnTheInjectedExecutor() {
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            EnsembleResult result = ensemble(pool).detect(dataset, BaselineSet.empty(), null);

            assertThat(result.getAnomalies()).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void realDetectorsAgreeOnANightSurge() {
        // two weeks of a daily cycle with one night-time surge
        List<ConsumptionRecord> history = TestRecords.hourly(TUNJA, WEDNESDAY, 336, t -> TestRecords.dailyCycle(t % 24));
        BaselineSet baselines = new BaselineCalculator().fit(history);
        List<ConsumptionRecord> window = TestRecords.hourly(TUNJA, WEDNESDAY, 240,
                t -> TestRecords.dailyCycle(t % 24) + (t == 122 ? 150 : 0));
        DetectorRegistry registry = new DetectorRegistry(List.of(new RuleBasedDetector(), new SeasonalResidualDetector()));
        EnsembleAnomalyDetector ensemble = new EnsembleAnomalyDetector(registry, new ConsensusMerger(), Runnable::run);

        EnsembleResult result = ensemble.detect(window, baselines, null);

        assertThat(result.getAnomalies()).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.getTimestamp()).isEqualTo(WEDNESDAY.plusHours(122));
            assertThat(anomaly.getDetectedBy()).containsExactly(DetectorKind.RULES, DetectorKind.RESIDUAL);
            assertThat(anomaly.getAnomalyTypes()).contains(AnomalyType.OFF_HOURS, AnomalyType.RESIDUAL_SPIKE);
        });
        assertThat(result.getAnomalies()).extracting(MergedAnomaly::getSeverity).doesNotContainNull();
    }

    private EnsembleAnomalyDetector ensemble(Executor executor) {
        DetectorRegistry registry = new DetectorRegistry(List.of(rules, residual, outlier));
        return new EnsembleAnomalyDetector(registry, new ConsensusMerger(), executor);
    }

    @Test
    void nonFiniteReadingPropagatesInsteadOfDegrading() {
        EnsembleAnomalyDetector ensemble = ensemble(Runnable::run);
        List<ConsumptionRecord> broken = List.of(TestRecords.record(TUNJA, TWO_AM, Double.NaN));

        assertThatThrownBy(() -> ensemble.detect(broken, BaselineSet.empty(), Severity.LOW))
                .isInstanceOf(InvalidDatasetException.class);
        verify(rules, never()).detect(any(), any(), any());
        verify(residual, never()).detect(any(), any(), any());
    }
}
