package com.ecoenergy.anomaly.rules;

import com.ecoenergy.anomaly.baseline.Baseline;
import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.ConsumptionRecord;

import java.util.Optional;
import java.util.Set;

/**
 * Night-time usage above a fraction of the working-hours mean.
 */
public final class OffHoursRule extends ConsumptionRule {

    private final Set<Integer> hours;

    public OffHoursRule(RuleSettings settings, Set<Integer> hours) {
        super(settings);
        this.hours = Set.copyOf(hours);
    }

    @Override
    public AnomalyType type() {
        return AnomalyType.OFF_HOURS;
    }

    @Override
    public Optional<AnomalyCandidate> evaluate(ConsumptionRecord record, Baseline baseline) {
        int hour = record.hour();
        if (!hours.contains(hour) || baseline.getWorkingHoursMean() <= 0) {
            return Optional.empty();
        }
        double expected = baseline.getNonWorkingMean();
        double threshold = baseline.getWorkingHoursMean() * settings.getMultiplier();
        double actual = record.getTotalEnergyKwh();
        if (actual <= threshold) {
            return Optional.empty();
        }
        double ratio = actual / baseline.getWorkingHoursMean();
        return Optional.of(candidate(record)
                .severity(settings.getSeverity().classify(ratio))
                .expectedValue(expected)
                .deviationPct(pctAbove(actual, threshold))
                .description(format("Consumption of %.2f kWh at %02d:00 while the expected maximum is %.2f kWh",
                        actual, hour, threshold))
                .recommendation("Check equipment left running outside working hours. "
                        + "Consider installing automatic timers.")
                .potentialSavingsKwh(AnomalyCandidate.savings(actual, expected))
                .build());
    }
}
