package com.ecoenergy.anomaly.rules;

import com.ecoenergy.anomaly.baseline.Baseline;
import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.ConsumptionRecord;

import java.util.Optional;

/**
 * High consumption while the buildings are mostly empty.
 */
public final class OccupancyImbalanceRule extends ConsumptionRule {

    private final double occupancyThresholdPct;

    public OccupancyImbalanceRule(RuleSettings settings, double occupancyThresholdPct) {
        super(settings);
        this.occupancyThresholdPct = occupancyThresholdPct;
    }

    @Override
    public AnomalyType type() {
        return AnomalyType.OCCUPANCY_IMBALANCE;
    }

    @Override
    public Optional<AnomalyCandidate> evaluate(ConsumptionRecord record, Baseline baseline) {
        Double occupancy = record.getOccupancyPct();
        if (occupancy == null || occupancy.isNaN() || occupancy >= occupancyThresholdPct || baseline.getMean() <= 0) {
            return Optional.empty();
        }
        double mean = baseline.getMean();
        double expected = mean * (occupancy / 100);
        double threshold = mean * settings.getMultiplier();
        double actual = record.getTotalEnergyKwh();
        if (actual <= threshold) {
            return Optional.empty();
        }
        double deviationPct = expected > 0 ? pctAbove(actual, expected) : 100;
        return Optional.of(candidate(record)
                .severity(settings.getSeverity().classify(actual / mean))
                .expectedValue(expected)
                .deviationPct(deviationPct)
                .description(format("Consumption of %.2f kWh with only %.0f%% occupancy. Expected: %.2f kWh",
                        actual, occupancy, expected))
                .recommendation("Review HVAC schedules against real occupancy. "
                        + "Consider presence sensors.")
                .potentialSavingsKwh(AnomalyCandidate.savings(actual, expected))
                .build());
    }
}
