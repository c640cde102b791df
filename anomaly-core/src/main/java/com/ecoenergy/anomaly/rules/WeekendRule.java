package com.ecoenergy.anomaly.rules;

import com.ecoenergy.anomaly.baseline.Baseline;
import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.ConsumptionRecord;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Weekend usage above a fraction of the weekday mean.
 */
public final class WeekendRule extends ConsumptionRule {

    private final Set<DayOfWeek> days;

    public WeekendRule(RuleSettings settings, Set<DayOfWeek> days) {
        super(settings);
        this.days = days.isEmpty() ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(days);
    }

    @Override
    public AnomalyType type() {
        return AnomalyType.WEEKEND;
    }

    @Override
    public Optional<AnomalyCandidate> evaluate(ConsumptionRecord record, Baseline baseline) {
        DayOfWeek day = record.dayOfWeek();
        if (!days.contains(day) || baseline.getWeekdayMean() <= 0) {
            return Optional.empty();
        }
        double expected = baseline.getWeekendMean();
        double threshold = baseline.getWeekdayMean() * settings.getMultiplier();
        double actual = record.getTotalEnergyKwh();
        if (actual <= threshold) {
            return Optional.empty();
        }
        double ratio = actual / baseline.getWeekdayMean();
        return Optional.of(candidate(record)
                .severity(settings.getSeverity().classify(ratio))
                .expectedValue(expected)
                .deviationPct(pctAbove(actual, threshold))
                .description(format("Consumption of %.2f kWh on %s while the expected maximum is %.2f kWh",
                        actual, day.getDisplayName(TextStyle.FULL, Locale.ENGLISH), threshold))
                .recommendation("Make sure non-essential equipment is switched off. "
                        + "Establish a weekend shutdown protocol.")
                .potentialSavingsKwh(AnomalyCandidate.savings(actual, expected))
                .build());
    }
}
