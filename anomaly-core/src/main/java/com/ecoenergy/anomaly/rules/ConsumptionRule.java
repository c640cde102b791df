package com.ecoenergy.anomaly.rules;

import com.ecoenergy.anomaly.baseline.Baseline;
import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.ConsumptionRecord;
import com.ecoenergy.anomaly.model.DetectionMethod;
import com.ecoenergy.anomaly.model.Sector;

import java.util.Locale;
import java.util.Optional;

/**
 * A named threshold rule. Evaluating a rule is a pure function of the record and the baseline; a
 * rule emits at most one candidate per record.
 */
public abstract class ConsumptionRule {

    protected final RuleSettings settings;

    protected ConsumptionRule(RuleSettings settings) {
        this.settings = settings;
    }

    public abstract AnomalyType type();

    public abstract Optional<AnomalyCandidate> evaluate(ConsumptionRecord record, Baseline baseline);

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    public RuleSettings settings() {
        return settings;
    }

    protected AnomalyCandidate.AnomalyCandidateBuilder candidate(ConsumptionRecord record) {
        return AnomalyCandidate.builder()
                .timestamp(record.getTimestamp())
                .site(record.getSite())
                .sector(Sector.TOTAL)
                .anomalyType(type())
                .actualValue(record.getTotalEnergyKwh())
                .detectionMethod(DetectionMethod.RULES);
    }

    protected static double pctAbove(double actual, double reference) {
        return (actual - reference) / reference * 100;
    }

    protected static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
