package com.ecoenergy.anomaly.rules;

import com.ecoenergy.anomaly.InvalidDatasetException;
import com.ecoenergy.anomaly.TestRecords;
import com.ecoenergy.anomaly.baseline.Baseline;
import com.ecoenergy.anomaly.baseline.BaselineSet;
import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.ConsumptionRecord;
import com.ecoenergy.anomaly.model.DetectionMethod;
import com.ecoenergy.anomaly.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ecoenergy.anomaly.TestRecords.DUITAMA;
import static com.ecoenergy.anomaly.TestRecords.SATURDAY;
import static com.ecoenergy.anomaly.TestRecords.TUNJA;
import static com.ecoenergy.anomaly.TestRecords.WEDNESDAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RuleBasedDetectorTest {

    private final RuleBasedDetector detector = new RuleBasedDetector();

    @Test
    void nightUsageAtEightyPercentOfWorkingMeanIsHigh() {
        Baseline baseline = TestRecords.baseline(TUNJA, 60, 30)
                .workingHoursMean(100)
                .nonWorkingMean(20)
                .build();
        ConsumptionRecord night = TestRecords.record(TUNJA, WEDNESDAY.withHour(3), 80);

        List<AnomalyCandidate> found = detector.detect(List.of(night), BaselineSet.of(Map.of(TUNJA, baseline)), null);

        assertThat(found).singleElement().satisfies(candidate -> {
            assertThat(candidate.getAnomalyType()).isEqualTo(AnomalyType.OFF_HOURS);
            assertThat(candidate.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(candidate.getExpectedValue()).isEqualTo(20.0);
            assertThat(candidate.getDeviationPct()).isCloseTo(128.571, within(1e-3));
            assertThat(candidate.getPotentialSavingsKwh()).isEqualTo(60.0);
            assertThat(candidate.getDetectionMethod()).isEqualTo(DetectionMethod.RULES);
        });
    }

    @Test
    void severityBoundaryIsInclusive() {
        Baseline baseline = TestRecords.baseline(TUNJA, 60, 30).workingHoursMean(100).build();

        List<AnomalyCandidate> found = detector.detectRecord(TestRecords.record(TUNJA, WEDNESDAY.withHour(23), 75), baseline);

        assertThat(found).extracting(AnomalyCandidate::getSeverity).containsExactly(Severity.HIGH);
    }

    @Test
    void daytimeUsageIsNotOffHours() {
        Baseline baseline = TestRecords.baseline(TUNJA, 60, 30).workingHoursMean(100).build();

        assertThat(detector.detectRecord(TestRecords.record(TUNJA, WEDNESDAY.withHour(6), 90), baseline)).isEmpty();
    }

    @Test
    void flatHistoryNeverProducesSpikes() {
        Baseline flat = TestRecords.baseline(TUNJA, 100, 0).build();

        List<AnomalyCandidate> found = detector.detectRecord(TestRecords.record(TUNJA, WEDNESDAY.withHour(12), 10_000), flat);

        assertThat(found).extracting(AnomalyCandidate::getAnomalyType).doesNotContain(AnomalyType.SPIKE);
    }

    @Test
    void spikeGradedOnZScore() {
        Baseline baseline = TestRecords.baseline(TUNJA, 100, 10).build();

        List<AnomalyCandidate> found = detector.detectRecord(TestRecords.record(TUNJA, WEDNESDAY.withHour(12), 160), baseline);

        assertThat(found).singleElement().satisfies(candidate -> {
            assertThat(candidate.getAnomalyType()).isEqualTo(AnomalyType.SPIKE);
            assertThat(candidate.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(candidate.getZScore()).isCloseTo(6.0, within(1e-9));
            assertThat(candidate.getDeviationPct()).isCloseTo(60.0, within(1e-9));
        });
    }

    @Test
    void spikeNeedsMinimumRelativeDeviation() {
        // z = 4 but only 40% above the mean
        Baseline baseline = TestRecords.baseline(TUNJA, 100, 10).build();

        assertThat(detector.detectRecord(TestRecords.record(TUNJA, WEDNESDAY.withHour(12), 140), baseline)).isEmpty();
    }

    @Test
    void weekendUsageComparedWithWeekdayMean() {
        Baseline baseline = TestRecords.baseline(TUNJA, 100, 50).weekdayMean(100).weekendMean(30).build();

        List<AnomalyCandidate> found = detector.detectRecord(TestRecords.record(TUNJA, SATURDAY.withHour(12), 65), baseline);

        assertThat(found).singleElement().satisfies(candidate -> {
            assertThat(candidate.getAnomalyType()).isEqualTo(AnomalyType.WEEKEND);
            assertThat(candidate.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(candidate.getExpectedValue()).isEqualTo(30.0);
            assertThat(candidate.getDescription()).contains("Saturday");
        });
    }

    @Test
    void lowOccupancyWithHighConsumption() {
        Baseline baseline = TestRecords.baseline(TUNJA, 100, 50).build();
        ConsumptionRecord record = TestRecords.reading(TUNJA, WEDNESDAY.withHour(12), 100).occupancyPct(10.0).build();

        List<AnomalyCandidate> found = detector.detectRecord(record, baseline);

        assertThat(found).singleElement().satisfies(candidate -> {
            assertThat(candidate.getAnomalyType()).isEqualTo(AnomalyType.OCCUPANCY_IMBALANCE);
            assertThat(candidate.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(candidate.getExpectedValue()).isCloseTo(10.0, within(1e-9));
            assertThat(candidate.getDeviationPct()).isCloseTo(900.0, within(1e-9));
        });
    }

    @Test
    void zeroOccupancyReportsFullDeviation() {
        Baseline baseline = TestRecords.baseline(TUNJA, 100, 50).build();
        ConsumptionRecord record = TestRecords.reading(TUNJA, WEDNESDAY.withHour(12), 90).occupancyPct(0.0).build();

        assertThat(detector.detectRecord(record, baseline))
                .singleElement()
                .extracting(AnomalyCandidate::getDeviationPct)
                .isEqualTo(100.0);
    }

    @Test
    void holidayUsageAboveThirtyPercentOfMean() {
        Baseline baseline = TestRecords.baseline(TUNJA, 100, 50).build();
        ConsumptionRecord record = TestRecords.reading(TUNJA, WEDNESDAY.withHour(12), 50).holiday(true).build();

        assertThat(detector.detectRecord(record, baseline))
                .singleElement()
                .satisfies(candidate -> {
                    assertThat(candidate.getAnomalyType()).isEqualTo(AnomalyType.HOLIDAY);
                    assertThat(candidate.getSeverity()).isEqualTo(Severity.MEDIUM);
                    assertThat(candidate.getExpectedValue()).isCloseTo(30.0, within(1e-9));
                });
    }

    @Test
    void vacationRuleRunsInBatchButNotOnTheRealTimePath() {
        Baseline baseline = TestRecords.baseline(TUNJA, 100, 50).build();
        ConsumptionRecord record = TestRecords.reading(TUNJA, WEDNESDAY.withHour(12), 90).academicPeriod("Vacation_Mid").build();

        List<AnomalyCandidate> batch = detector.detect(List.of(record), BaselineSet.of(Map.of(TUNJA, baseline)), Severity.LOW);

        assertThat(batch).singleElement().satisfies(candidate -> {
            assertThat(candidate.getAnomalyType()).isEqualTo(AnomalyType.VACATION_HIGH);
            assertThat(candidate.getSeverity()).isEqualTo(Severity.CRITICAL);
        });
        assertThat(detector.detectRecord(record, baseline)).isEmpty();
        assertThat(detector.activeRealTimeRules()).doesNotContain(AnomalyType.VACATION_HIGH);
    }

    @Test
    void sitesWithoutBaselineAreSkipped() {
        Baseline tunja = TestRecords.baseline(TUNJA, 60, 30).workingHoursMean(100).build();
        List<ConsumptionRecord> dataset = List.of(
                TestRecords.record(TUNJA, WEDNESDAY.withHour(3), 80),
                TestRecords.record(DUITAMA, WEDNESDAY.withHour(3), 500));

        List<AnomalyCandidate> found = detector.detect(dataset, BaselineSet.of(Map.of(TUNJA, tunja)), null);

        assertThat(found).extracting(AnomalyCandidate::getSite).containsOnly(TUNJA);
    }

    @Test
    void minimumSeverityFiltersAfterEvaluation() {
        Baseline baseline = TestRecords.baseline(TUNJA, 60, 30).workingHoursMean(100).build();
        List<ConsumptionRecord> nights = List.of(
                TestRecords.record(TUNJA, WEDNESDAY.withHour(1), 40),
                TestRecords.record(TUNJA, WEDNESDAY.withHour(2), 80),
                TestRecords.record(TUNJA, WEDNESDAY.withHour(3), 120));

        List<AnomalyCandidate> found = detector.detect(nights, BaselineSet.of(Map.of(TUNJA, baseline)), Severity.HIGH);

        assertThat(found).extracting(AnomalyCandidate::getSeverity)
                .containsExactly(Severity.HIGH, Severity.CRITICAL);
    }

    @Test
    void disabledRulesAreNotEvaluated() {
        RuleConfig config = RuleConfig.builder()
                .offHours(RuleSettings.of(0.35, SeverityTable.of(0.35, 0.5, 0.75, 1.0)).toBuilder().enabled(false).build())
                .build();
        RuleBasedDetector withoutOffHours = new RuleBasedDetector(config);
        Baseline baseline = TestRecords.baseline(TUNJA, 60, 30).workingHoursMean(100).build();

        assertThat(withoutOffHours.activeRules()).doesNotContain(AnomalyType.OFF_HOURS);
        assertThat(withoutOffHours.detectRecord(TestRecords.record(TUNJA, WEDNESDAY.withHour(3), 80), baseline)).isEmpty();
    }

    @Test
    void nonRuleTypesCannotRunInRealTime() {
        RuleConfig config = RuleConfig.builder().realTimeRules(Set.of(AnomalyType.RESIDUAL_SPIKE)).build();

        assertThatThrownBy(() -> new RuleBasedDetector(config)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void detectionIsRepeatable() {
        Baseline baseline = TestRecords.baseline(TUNJA, 60, 10).workingHoursMean(100).build();
        List<ConsumptionRecord> day = TestRecords.hourly(TUNJA, WEDNESDAY, 24, i -> i < 6 ? 70 : 130);
        BaselineSet baselines = BaselineSet.of(Map.of(TUNJA, baseline));

        assertThat(detector.detect(day, baselines, null)).isEqualTo(detector.detect(day, baselines, null));
    }

    @Test
    void nonFiniteReadingIsRejectedInsteadOfMatchingEveryRule() {
        Baseline baseline = TestRecords.baseline(TUNJA, 60, 30).workingHoursMean(100).build();
        ConsumptionRecord broken = TestRecords.reading(TUNJA, SATURDAY.withHour(3), Double.NaN)
                .holiday(true)
                .occupancyPct(10.0)
                .academicPeriod("vacation")
                .build();

        assertThatThrownBy(() -> detector.detect(List.of(broken), BaselineSet.of(Map.of(TUNJA, baseline)), null))
                .isInstanceOf(InvalidDatasetException.class)
                .hasMessageContaining("Tunja");
        assertThatThrownBy(() -> detector.detectRecord(broken, baseline))
                .isInstanceOf(InvalidDatasetException.class);
    }
}
