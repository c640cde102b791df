package com.ecoenergy.anomaly.service.config;

import com.ecoenergy.anomaly.ensemble.MergerConfig;
import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.DetectorKind;
import com.ecoenergy.anomaly.model.SiteRegistry;
import com.ecoenergy.anomaly.outlier.OutlierConfig;
import com.ecoenergy.anomaly.residual.ResidualConfig;
import com.ecoenergy.anomaly.rules.RuleConfig;
import com.ecoenergy.anomaly.rules.RuleSettings;
import com.ecoenergy.anomaly.rules.SeverityTable;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Settings bound from {@code anomaly.*}. Every section is optional; anything left out keeps the
 * library default.
 */
@ConfigurationProperties(prefix = "anomaly")
public record AnomalyProperties(
        List<String> sites,
        Rules rules,
        Residual residual,
        Outlier outlier,
        Ensemble ensemble
) {

    public AnomalyProperties {
        if (sites == null || sites.isEmpty()) {
            sites = SiteRegistry.DEFAULT_SITES;
        }
        if (rules == null) {
            rules = new Rules(null, null, null, null, null, null, null, null, null, null, null, null, null);
        }
        if (residual == null) {
            residual = new Residual(null, null, null, null, null);
        }
        if (outlier == null) {
            outlier = new Outlier(null, null, null, null, null, null);
        }
        if (ensemble == null) {
            ensemble = new Ensemble(null, null, null, null);
        }
    }

    public SiteRegistry siteRegistry() {
        return SiteRegistry.of(sites);
    }

    /** One rule's switch, multiplier and four severity cutoffs (low, medium, high, critical). */
    public record Rule(Boolean enabled, Double multiplier, List<Double> severity) {

        RuleSettings apply(RuleSettings defaults) {
            RuleSettings.RuleSettingsBuilder builder = defaults.toBuilder();
            if (enabled != null) builder.enabled(enabled);
            if (multiplier != null) builder.multiplier(multiplier);
            if (severity != null) builder.severity(table(severity, "rule severity"));
            return builder.build();
        }
    }

    public record Rules(
            Rule offHours,
            List<Integer> offHoursHours,
            Rule weekend,
            List<DayOfWeek> weekendDays,
            Rule spike,
            Double spikeZScoreThreshold,
            Double spikeMinDeviationPct,
            Rule occupancy,
            Double occupancyThresholdPct,
            Rule holiday,
            Rule vacation,
            List<String> vacationPeriods,
            List<String> realTimeRules
    ) {

        public RuleConfig toRuleConfig() {
            RuleConfig defaults = RuleConfig.defaults();
            RuleConfig.RuleConfigBuilder builder = defaults.toBuilder();
            if (offHours != null) builder.offHours(offHours.apply(defaults.getOffHours()));
            if (offHoursHours != null) builder.offHoursHours(new TreeSet<>(offHoursHours));
            if (weekend != null) builder.weekend(weekend.apply(defaults.getWeekend()));
            if (weekendDays != null) builder.weekendDays(Set.copyOf(weekendDays));
            if (spike != null) builder.spike(spike.apply(defaults.getSpike()));
            if (spikeZScoreThreshold != null) builder.spikeZScoreThreshold(spikeZScoreThreshold);
            if (spikeMinDeviationPct != null) builder.spikeMinDeviationPct(spikeMinDeviationPct);
            if (occupancy != null) builder.occupancy(occupancy.apply(defaults.getOccupancy()));
            if (occupancyThresholdPct != null) builder.occupancyThresholdPct(occupancyThresholdPct);
            if (holiday != null) builder.holiday(holiday.apply(defaults.getHoliday()));
            if (vacation != null) builder.vacation(vacation.apply(defaults.getVacation()));
            if (vacationPeriods != null) builder.vacationPeriods(new LinkedHashSet<>(vacationPeriods));
            if (realTimeRules != null) {
                builder.realTimeRules(realTimeRules.stream()
                        .map(AnomalyType::fromCode)
                        .collect(Collectors.toSet()));
            }
            return builder.build().validate();
        }
    }

    public record Residual(
            Integer seasonalPeriod,
            Double zScoreThreshold,
            List<Double> severity,
            Double trendZScoreThreshold,
            Integer trendWindow
    ) {

        public ResidualConfig toResidualConfig() {
            ResidualConfig.ResidualConfigBuilder builder = ResidualConfig.defaults().toBuilder();
            if (seasonalPeriod != null) builder.seasonalPeriod(seasonalPeriod);
            if (zScoreThreshold != null) builder.zScoreThreshold(zScoreThreshold);
            if (severity != null) builder.severity(table(severity, "residual severity"));
            if (trendZScoreThreshold != null) builder.trendZScoreThreshold(trendZScoreThreshold);
            if (trendWindow != null) builder.trendWindow(trendWindow);
            return builder.build().validate();
        }
    }

    /**
     * @param modelPath serialized Smile isolation forest; blank disables the outlier detector
     */
    public record Outlier(
            String modelPath,
            Double decisionThreshold,
            Double criticalCutoff,
            Double highCutoff,
            Double mediumCutoff,
            List<String> excludedColumns
    ) {

        public boolean modelConfigured() {
            return modelPath != null && !modelPath.isBlank();
        }

        public OutlierConfig toOutlierConfig() {
            OutlierConfig.OutlierConfigBuilder builder = OutlierConfig.defaults().toBuilder();
            if (decisionThreshold != null) builder.decisionThreshold(decisionThreshold);
            if (criticalCutoff != null) builder.criticalCutoff(criticalCutoff);
            if (highCutoff != null) builder.highCutoff(highCutoff);
            if (mediumCutoff != null) builder.mediumCutoff(mediumCutoff);
            if (excludedColumns != null) builder.clearExcludedColumns().excludedColumns(excludedColumns);
            return builder.build().validate();
        }
    }

    /**
     * @param weights keyed by detector name ({@code rules}, {@code residual}, {@code outlier-model})
     * @param parallelism threads running detectors; defaults to one per detector
     */
    public record Ensemble(
            Integer minConsensus,
            Map<String, Double> weights,
            Double defaultWeight,
            Integer parallelism
    ) {

        public Ensemble {
            if (parallelism != null && parallelism < 1) {
                throw new IllegalArgumentException("anomaly.ensemble.parallelism must be at least 1");
            }
        }

        public int threads() {
            return parallelism == null ? DetectorKind.values().length : parallelism;
        }

        public MergerConfig toMergerConfig() {
            MergerConfig.MergerConfigBuilder builder = MergerConfig.defaults().toBuilder();
            if (minConsensus != null) builder.minConsensus(minConsensus);
            if (defaultWeight != null) builder.defaultWeight(defaultWeight);
            if (weights != null) {
                Map<DetectorKind, Double> byKind = new EnumMap<>(MergerConfig.defaults().getWeights());
                weights.forEach((name, weight) ->
                        byKind.put(DetectorKind.fromName(name.trim().replace('-', '_').toLowerCase(Locale.ROOT)), weight));
                builder.weights(byKind);
            }
            return builder.build().validate();
        }
    }

    private static SeverityTable table(List<Double> cutoffs, String name) {
        if (cutoffs.size() != 4) {
            throw new IllegalArgumentException(name + " needs four cutoffs (low, medium, high, critical), got " + cutoffs);
        }
        return SeverityTable.of(cutoffs.get(0), cutoffs.get(1), cutoffs.get(2), cutoffs.get(3));
    }
}
