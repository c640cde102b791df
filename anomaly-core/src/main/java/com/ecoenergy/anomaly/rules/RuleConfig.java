package com.ecoenergy.anomaly.rules;

import com.ecoenergy.anomaly.model.AnomalyType;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Thresholds of the rule engine, one instance per {@link RuleBasedDetector}.
 */
@Value
@Builder(toBuilder = true)
public class RuleConfig {

    public static final Set<AnomalyType> RULE_TYPES = Collections.unmodifiableSet(EnumSet.of(
            AnomalyType.OFF_HOURS, AnomalyType.WEEKEND, AnomalyType.SPIKE,
            AnomalyType.OCCUPANCY_IMBALANCE, AnomalyType.HOLIDAY, AnomalyType.VACATION_HIGH));

    @NonNull
    @Builder.Default
    RuleSettings offHours = RuleSettings.of(0.35, SeverityTable.of(0.35, 0.50, 0.75, 1.0));
    @NonNull
    @Builder.Default
    Set<Integer> offHoursHours = Collections.unmodifiableSet(new TreeSet<>(Set.of(22, 23, 0, 1, 2, 3, 4, 5)));

    @NonNull
    @Builder.Default
    RuleSettings weekend = RuleSettings.of(0.40, SeverityTable.of(0.40, 0.60, 0.80, 1.0));
    @NonNull
    @Builder.Default
    Set<DayOfWeek> weekendDays = Collections.unmodifiableSet(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY));

    /** The multiplier is unused here; the spike rule fires on z-score and deviation. */
    @NonNull
    @Builder.Default
    RuleSettings spike = RuleSettings.of(1.0, SeverityTable.of(3.0, 4.0, 5.0, 6.0));
    @Builder.Default
    double spikeZScoreThreshold = 3.0;
    @Builder.Default
    double spikeMinDeviationPct = 50.0;

    @NonNull
    @Builder.Default
    RuleSettings occupancy = RuleSettings.of(0.70, SeverityTable.of(0.70, 0.85, 1.0, 1.2));
    @Builder.Default
    double occupancyThresholdPct = 30.0;

    @NonNull
    @Builder.Default
    RuleSettings holiday = RuleSettings.of(0.30, SeverityTable.of(0.30, 0.45, 0.60, 0.80));

    @NonNull
    @Builder.Default
    RuleSettings vacation = RuleSettings.of(0.40, SeverityTable.of(0.40, 0.55, 0.70, 0.85));
    @NonNull
    @Builder.Default
    Set<String> vacationPeriods = Collections.unmodifiableSet(new LinkedHashSet<>(List.of("vacation", "vacation_mid", "vacation_end")));

    /** Rules evaluated on the single-record path. */
    @NonNull
    @Builder.Default
    Set<AnomalyType> realTimeRules = Collections.unmodifiableSet(EnumSet.of(
            AnomalyType.OFF_HOURS, AnomalyType.WEEKEND, AnomalyType.SPIKE,
            AnomalyType.OCCUPANCY_IMBALANCE, AnomalyType.HOLIDAY));

    public static RuleConfig defaults() {
        return RuleConfig.builder().build();
    }

    public RuleSettings settingsFor(AnomalyType type) {
        return switch (type) {
            case OFF_HOURS -> offHours;
            case WEEKEND -> weekend;
            case SPIKE -> spike;
            case OCCUPANCY_IMBALANCE -> occupancy;
            case HOLIDAY -> holiday;
            case VACATION_HIGH -> vacation;
            case RESIDUAL_SPIKE, RESIDUAL_DROP, STATISTICAL_OUTLIER ->
                    throw new IllegalArgumentException(type + " is not produced by the rule engine");
        };
    }

    public RuleConfig validate() {
        for (AnomalyType type : realTimeRules) {
            if (!RULE_TYPES.contains(type)) {
                throw new IllegalArgumentException(type + " is not a rule and cannot run in real time");
            }
        }
        for (Integer hour : offHoursHours) {
            if (hour == null || hour < 0 || hour > 23) {
                throw new IllegalArgumentException("Off-hours hour out of range: " + hour);
            }
        }
        if (spikeZScoreThreshold <= 0) {
            throw new IllegalArgumentException("Spike z-score threshold must be positive");
        }
        if (occupancyThresholdPct < 0 || occupancyThresholdPct > 100) {
            throw new IllegalArgumentException("Occupancy threshold must be within 0..100");
        }
        return this;
    }
}
