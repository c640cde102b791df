package com.ecoenergy.anomaly.rules;

import com.ecoenergy.anomaly.baseline.Baseline;
import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.ConsumptionRecord;

import java.util.Optional;

/**
 * Reading far above the site mean, both in z-score and in relative terms. Disabled for sites whose
 * history has no variance.
 */
public final class ConsumptionSpikeRule extends ConsumptionRule {

    private final double zScoreThreshold;
    private final double minDeviationPct;

    public ConsumptionSpikeRule(RuleSettings settings, double zScoreThreshold, double minDeviationPct) {
        super(settings);
        this.zScoreThreshold = zScoreThreshold;
        this.minDeviationPct = minDeviationPct;
    }

    @Override
    public AnomalyType type() {
        return AnomalyType.SPIKE;
    }

    @Override
    public Optional<AnomalyCandidate> evaluate(ConsumptionRecord record, Baseline baseline) {
        if (!baseline.hasVariance() || baseline.getMean() <= 0) {
            return Optional.empty();
        }
        double mean = baseline.getMean();
        double actual = record.getTotalEnergyKwh();
        double zScore = baseline.zScore(actual);
        if (zScore < zScoreThreshold) {
            return Optional.empty();
        }
        double deviationPct = pctAbove(actual, mean);
        if (deviationPct < minDeviationPct) {
            return Optional.empty();
        }
        return Optional.of(candidate(record)
                .severity(settings.getSeverity().classify(zScore))
                .expectedValue(mean)
                .deviationPct(deviationPct)
                .zScore(zScore)
                .description(format("Consumption spike of %.2f kWh (z-score %.1f, %.0f%% above the mean)",
                        actual, zScore, deviationPct))
                .recommendation("Investigate the cause of the spike. "
                        + "Check for simultaneous start-up of high-power equipment.")
                .potentialSavingsKwh(AnomalyCandidate.savings(actual, mean))
                .build());
    }
}
