package com.ecoenergy.anomaly.residual;

import com.ecoenergy.anomaly.baseline.BaselineCalculator;
import com.ecoenergy.anomaly.baseline.BaselineSet;
import com.ecoenergy.anomaly.baseline.Stats;
import com.ecoenergy.anomaly.ensemble.BatchDetector;
import com.ecoenergy.anomaly.model.AnomalyCandidate;
import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.ConsumptionRecord;
import com.ecoenergy.anomaly.model.DetectionMethod;
import com.ecoenergy.anomaly.model.DetectorKind;
import com.ecoenergy.anomaly.model.Sector;
import com.ecoenergy.anomaly.model.Severity;
import com.ecoenergy.anomaly.model.Site;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Flags readings whose residual, after removing trend and daily seasonality, is an outlier within
 * the site's own residual distribution. Works on the dataset window only; baselines are not used.
 */
@Slf4j
public class SeasonalResidualDetector implements BatchDetector {

    private final SeasonalDecomposer decomposer;
    private final ResidualConfig config;

    public SeasonalResidualDetector(SeasonalDecomposer decomposer, ResidualConfig config) {
        this.decomposer = decomposer;
        this.config = config.validate();
    }

    public SeasonalResidualDetector() {
        this(new MovingAverageDecomposer(), ResidualConfig.defaults());
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.RESIDUAL;
    }

    @Override
    public boolean available() {
        return decomposer != null && decomposer.available();
    }

    @Override
    public List<AnomalyCandidate> detect(List<ConsumptionRecord> dataset, BaselineSet baselines, Severity minSeverity) {
        List<AnomalyCandidate> anomalies = new ArrayList<>();
        sortedBySite(dataset).forEach((site, records) -> anomalies.addAll(detectSite(site, records, minSeverity)));
        log.info("Residual detector found {} anomalies", anomalies.size());
        return anomalies;
    }

    public Decomposition decompose(List<ConsumptionRecord> siteRecords) {
        double[] series = totals(siteRecords);
        if (series.length < config.getSeasonalPeriod() * 2) {
            log.info("Not enough data to decompose: {} samples, need {}", series.length, config.getSeasonalPeriod() * 2);
            return Decomposition.identity(series);
        }
        try {
            return decomposer.decompose(series, config.getSeasonalPeriod());
        } catch (RuntimeException e) {
            log.error("Seasonal decomposition failed, using identity fallback: {}", e.getMessage(), e);
            return Decomposition.identity(series);
        }
    }

    private List<AnomalyCandidate> detectSite(Site site, List<ConsumptionRecord> records, Severity minSeverity) {
        Decomposition components = decompose(records);
        if (components.isIdentity()) {
            return List.of();
        }
        double[] residuals = components.getResidual();
        double residualMean = Stats.mean(residuals);
        double residualStd = Stats.std(residuals);
        if (residualStd == 0) {
            return List.of();
        }

        List<AnomalyCandidate> found = new ArrayList<>();
        for (int i = 0; i < residuals.length; i++) {
            double z = (residuals[i] - residualMean) / residualStd;
            double absZ = Math.abs(z);
            if (absZ < config.getZScoreThreshold()) {
                continue;
            }
            Severity severity = config.getSeverity().classify(absZ);
            if (!severity.atLeast(minSeverity)) {
                continue;
            }
            ConsumptionRecord record = records.get(i);
            double actual = record.getTotalEnergyKwh();
            double expected = components.expectedAt(i);
            double deviationPct = expected != 0 ? (actual - expected) / expected * 100 : 0;
            boolean spike = z > 0;

            Map<String, Double> context = new LinkedHashMap<>();
            context.put("trend", components.trendAt(i));
            context.put("seasonal", components.seasonalAt(i));
            context.put("residual", residuals[i]);

            found.add(AnomalyCandidate.builder()
                    .timestamp(record.getTimestamp())
                    .site(site)
                    .sector(Sector.TOTAL)
                    .anomalyType(spike ? AnomalyType.RESIDUAL_SPIKE : AnomalyType.RESIDUAL_DROP)
                    .severity(severity)
                    .actualValue(actual)
                    .expectedValue(expected)
                    .deviationPct(deviationPct)
                    .zScore(z)
                    .description(spike
                            ? String.format(Locale.ROOT, "Abnormally high consumption of %.2f kWh "
                                    + "(expected %.2f kWh from trend and seasonality)", actual, expected)
                            : String.format(Locale.ROOT, "Abnormally low consumption of %.2f kWh "
                                    + "(expected %.2f kWh)", actual, expected))
                    .recommendation(spike
                            ? "Investigate the cause of the increase. Check for special events or equipment faults."
                            : "Check for an unscheduled closure or a metering fault.")
                    .potentialSavingsKwh(AnomalyCandidate.savings(actual, expected))
                    .detectionMethod(DetectionMethod.SEASONAL_RESIDUAL)
                    .context(context)
                    .build());
        }
        return found;
    }

    /**
     * Second difference of the trend component, z-scored. Not part of the default ensemble.
     */
    public List<TrendChange> detectTrendChanges(List<ConsumptionRecord> dataset) {
        List<TrendChange> changes = new ArrayList<>();
        sortedBySite(dataset).forEach((site, records) -> {
            if (records.size() < config.getTrendWindow() * 2) {
                log.info("Not enough data for trend changes at site {}: {} < {}",
                        site, records.size(), config.getTrendWindow() * 2);
                return;
            }
            Decomposition components = decompose(records);
            if (components.isIdentity()) {
                return;
            }
            double[] trend = components.getTrend();
            double[] acceleration = new double[trend.length - 2];
            for (int i = 2; i < trend.length; i++) {
                acceleration[i - 2] = trend[i] - 2 * trend[i - 1] + trend[i - 2];
            }
            double accelMean = Stats.mean(acceleration);
            double accelStd = Stats.std(acceleration);
            if (accelStd == 0) {
                return;
            }
            for (int i = 0; i < acceleration.length; i++) {
                double z = (acceleration[i] - accelMean) / accelStd;
                if (Math.abs(z) < config.getTrendZScoreThreshold()) {
                    continue;
                }
                TrendChange.Direction direction = z > 0 ? TrendChange.Direction.INCREASING : TrendChange.Direction.DECREASING;
                changes.add(TrendChange.builder()
                        .timestamp(records.get(i + 2).getTimestamp())
                        .site(site)
                        .direction(direction)
                        .zScore(z)
                        .description("Significant change in the consumption trend ("
                                + direction.name().toLowerCase(Locale.ROOT) + ")")
                        .recommendation("Investigate recent changes in operation or infrastructure.")
                        .build());
            }
        });
        log.info("Residual detector found {} trend changes", changes.size());
        return changes;
    }

    /**
     * Average seasonal component by hour of day for {@code site}. Empty when the site has fewer than
     * two seasonal periods of data.
     */
    public Optional<SeasonalProfile> seasonalProfile(List<ConsumptionRecord> dataset, Site site) {
        List<ConsumptionRecord> records = sortedBySite(dataset).get(site);
        if (records == null || records.size() < config.getSeasonalPeriod() * 2) {
            return Optional.empty();
        }
        Decomposition components = decompose(records);
        if (components.isIdentity()) {
            return Optional.empty();
        }
        Map<Integer, List<Double>> byHour = new TreeMap<>();
        for (int i = 0; i < records.size(); i++) {
            byHour.computeIfAbsent(records.get(i).hour(), k -> new ArrayList<>()).add(components.seasonalAt(i));
        }
        Map<Integer, Double> pattern = new TreeMap<>();
        byHour.forEach((hour, values) -> pattern.put(hour, Stats.mean(values)));

        Map.Entry<Integer, Double> peak = pattern.entrySet().stream().max(Map.Entry.comparingByValue()).orElseThrow();
        Map.Entry<Integer, Double> trough = pattern.entrySet().stream().min(Map.Entry.comparingByValue()).orElseThrow();
        return Optional.of(SeasonalProfile.builder()
                .site(site)
                .hourlyPattern(pattern)
                .peakHour(peak.getKey())
                .peakValue(peak.getValue())
                .troughHour(trough.getKey())
                .troughValue(trough.getValue())
                .amplitude(peak.getValue() - trough.getValue())
                .meanTrend(Stats.mean(components.getTrend()))
                .build());
    }

    public ResidualConfig config() {
        return config;
    }

    private static Map<Site, List<ConsumptionRecord>> sortedBySite(List<ConsumptionRecord> dataset) {
        Map<Site, List<ConsumptionRecord>> bySite = BaselineCalculator.partitionBySite(dataset);
        bySite.values().forEach(records -> records.sort(Comparator.comparing(ConsumptionRecord::getTimestamp)));
        return bySite;
    }

    private static double[] totals(List<ConsumptionRecord> records) {
        double[] series = new double[records.size()];
        for (int i = 0; i < series.length; i++) {
            series[i] = records.get(i).getTotalEnergyKwh();
        }
        return series;
    }
}
