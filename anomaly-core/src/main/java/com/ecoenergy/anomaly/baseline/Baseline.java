package com.ecoenergy.anomaly.baseline;

import com.ecoenergy.anomaly.model.Sector;
import com.ecoenergy.anomaly.model.Site;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Historical statistics of one site's total energy, produced by {@link BaselineCalculator}.
 * Read-only: a refit builds a new instance.
 */
@Value
public class Baseline {

    Site site;
    long sampleCount;
    double mean;
    double std;
    double median;
    double p95;
    double p99;
    Map<Integer, Double> hourlyMean;
    Map<Integer, Double> hourlyStd;
    Map<DayOfWeek, Double> dailyMean;
    double workingHoursMean;
    double nonWorkingMean;
    double weekendMean;
    double weekdayMean;
    Map<Sector, Double> sectorMean;
    Map<Sector, Double> sectorStd;
    Instant fittedAt;

    @Builder
    private Baseline(@NonNull Site site,
                     long sampleCount,
                     double mean,
                     double std,
                     double median,
                     double p95,
                     double p99,
                     Map<Integer, Double> hourlyMean,
                     Map<Integer, Double> hourlyStd,
                     Map<DayOfWeek, Double> dailyMean,
                     double workingHoursMean,
                     double nonWorkingMean,
                     double weekendMean,
                     double weekdayMean,
                     Map<Sector, Double> sectorMean,
                     Map<Sector, Double> sectorStd,
                     Instant fittedAt) {
        this.site = site;
        this.sampleCount = sampleCount;
        this.mean = mean;
        this.std = std;
        this.median = median;
        this.p95 = p95;
        this.p99 = p99;
        this.hourlyMean = hourlyMean == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(hourlyMean));
        this.hourlyStd = hourlyStd == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(hourlyStd));
        this.dailyMean = dailyMean == null ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(dailyMean));
        this.workingHoursMean = workingHoursMean;
        this.nonWorkingMean = nonWorkingMean;
        this.weekendMean = weekendMean;
        this.weekdayMean = weekdayMean;
        this.sectorMean = copySectors(sectorMean);
        this.sectorStd = copySectors(sectorStd);
        this.fittedAt = fittedAt == null ? Instant.now() : fittedAt;
    }

    /** False when the history is flat, in which case no z-score can be formed. */
    public boolean hasVariance() {
        return std > 0;
    }

    public double zScore(double value) {
        return hasVariance() ? (value - mean) / std : 0.0;
    }

    private static Map<Sector, Double> copySectors(Map<Sector, Double> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new EnumMap<>(source));
    }
}
