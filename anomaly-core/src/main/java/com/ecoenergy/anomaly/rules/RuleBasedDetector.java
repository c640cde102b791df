package com.ecoenergy.anomaly.rules;

import com.ecoenergy.anomaly.baseline.Baseline;
import com.ecoenergy.anomaly.baseline.BaselineCalculator;
import com.ecoenergy.anomaly.baseline.BaselineSet;
import com.ecoenergy.anomaly.ensemble.BatchDetector;
import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.ConsumptionRecord;
import com.ecoenergy.anomaly.model.DetectorKind;
import com.ecoenergy.anomaly.model.Severity;
import com.ecoenergy.anomaly.model.Site;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates the ordered rule list against fitted baselines. A record may trigger several rules.
 */
@Slf4j
public class RuleBasedDetector implements BatchDetector {

    private final RuleConfig config;
    private final List<ConsumptionRule> rules;
    private final List<ConsumptionRule> realTimeRules;

    public RuleBasedDetector(RuleConfig config) {
        this.config = config.validate();
        List<ConsumptionRule> all = List.of(
                new OffHoursRule(config.getOffHours(), config.getOffHoursHours()),
                new WeekendRule(config.getWeekend(), config.getWeekendDays()),
                new ConsumptionSpikeRule(config.getSpike(), config.getSpikeZScoreThreshold(), config.getSpikeMinDeviationPct()),
                new OccupancyImbalanceRule(config.getOccupancy(), config.getOccupancyThresholdPct()),
                new HolidayRule(config.getHoliday()),
                new VacationPeriodRule(config.getVacation(), config.getVacationPeriods()));
        this.rules = all.stream().filter(ConsumptionRule::isEnabled).toList();
        this.realTimeRules = rules.stream()
                .filter(rule -> config.getRealTimeRules().contains(rule.type()))
                .toList();
        log.info("Rule engine ready, batch rules:{} real-time rules:{}", types(rules), types(realTimeRules));
    }

    public RuleBasedDetector() {
        this(RuleConfig.defaults());
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.RULES;
    }

    @Override
    public boolean available() {
        return true;
    }

    @Override
    public List<AnomalyCandidate> detect(List<ConsumptionRecord> dataset, BaselineSet baselines, Severity minSeverity) {
        List<AnomalyCandidate> anomalies = new ArrayList<>();
        Map<Site, List<ConsumptionRecord>> bySite = BaselineCalculator.partitionBySite(dataset);
        bySite.forEach((site, records) -> {
            Optional<Baseline> baseline = baselines.forSite(site);
            if (baseline.isEmpty()) {
                log.warn("No baseline for site {}, skipping {} records", site, records.size());
                return;
            }
            for (ConsumptionRecord record : records) {
                for (AnomalyCandidate candidate : evaluate(record, baseline.get(), rules)) {
                    if (candidate.getSeverity().atLeast(minSeverity)) {
                        anomalies.add(candidate);
                    }
                }
            }
        });
        log.info("Rules detected {} anomalies", anomalies.size());
        return anomalies;
    }

    /**
     * Runs the configured real-time subset against one record. Cost depends only on the number of
     * active rules.
     */
    public List<AnomalyCandidate> detectRecord(ConsumptionRecord record, Baseline baseline) {
        BaselineCalculator.requireFiniteTotal(record);
        return evaluate(record, baseline, realTimeRules);
    }

    public List<AnomalyType> activeRules() {
        return types(rules);
    }

    public List<AnomalyType> activeRealTimeRules() {
        return types(realTimeRules);
    }

    public RuleConfig config() {
        return config;
    }

    private static List<AnomalyCandidate> evaluate(ConsumptionRecord record, Baseline baseline, List<ConsumptionRule> ruleSet) {
        List<AnomalyCandidate> found = new ArrayList<>(2);
        for (ConsumptionRule rule : ruleSet) {
            rule.evaluate(record, baseline).ifPresent(found::add);
        }
        return found;
    }

    private static List<AnomalyType> types(List<ConsumptionRule> ruleSet) {
        return ruleSet.stream().map(ConsumptionRule::type).toList();
    }
}
