package com.ecoenergy.anomaly.rules;

import com.ecoenergy.anomaly.baseline.Baseline;
import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.ConsumptionRecord;

import java.util.Optional;

public final class HolidayRule extends ConsumptionRule {

    public HolidayRule(RuleSettings settings) {
        super(settings);
    }

    @Override
    public AnomalyType type() {
        return AnomalyType.HOLIDAY;
    }

    @Override
    public Optional<AnomalyCandidate> evaluate(ConsumptionRecord record, Baseline baseline) {
        if (!record.isHoliday() || baseline.getMean() <= 0) {
            return Optional.empty();
        }
        double expected = baseline.getMean() * settings.getMultiplier();
        double actual = record.getTotalEnergyKwh();
        if (actual <= expected) {
            return Optional.empty();
        }
        return Optional.of(candidate(record)
                .severity(settings.getSeverity().classify(actual / baseline.getMean()))
                .expectedValue(expected)
                .deviationPct(pctAbove(actual, expected))
                .description(format("Consumption of %.2f kWh on a public holiday. Expected maximum: %.2f kWh",
                        actual, expected))
                .recommendation("Check equipment running during the holiday. "
                        + "Apply the holiday shutdown protocol.")
                .potentialSavingsKwh(AnomalyCandidate.savings(actual, expected))
                .build());
    }
}
