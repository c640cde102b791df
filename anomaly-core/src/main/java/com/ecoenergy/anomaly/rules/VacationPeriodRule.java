package com.ecoenergy.anomaly.rules;

import com.ecoenergy.anomaly.baseline.Baseline;
import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.ConsumptionRecord;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * High consumption while the academic calendar says the campus is on vacation.
 */
public final class VacationPeriodRule extends ConsumptionRule {

    private final Set<String> periods;

    public VacationPeriodRule(RuleSettings settings, Set<String> periods) {
        super(settings);
        this.periods = periods.stream()
                .map(p -> p.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public AnomalyType type() {
        return AnomalyType.VACATION_HIGH;
    }

    @Override
    public Optional<AnomalyCandidate> evaluate(ConsumptionRecord record, Baseline baseline) {
        String period = record.getAcademicPeriod();
        if (period == null || !periods.contains(period.trim().toLowerCase(Locale.ROOT)) || baseline.getMean() <= 0) {
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
                .description(format("Consumption of %.2f kWh during academic vacation. Expected maximum: %.2f kWh",
                        actual, expected))
                .recommendation("Review equipment left on during vacation. "
                        + "Use the period for preventive maintenance.")
                .potentialSavingsKwh(AnomalyCandidate.savings(actual, expected))
                .build());
    }
}
