package com.ecoenergy.anomaly.baseline;

import com.ecoenergy.anomaly.InvalidDatasetException;
import com.ecoenergy.anomaly.model.ConsumptionRecord;
import com.ecoenergy.anomaly.model.Sector;
import com.ecoenergy.anomaly.model.Site;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes per-site {@link Baseline}s from a historical dataset. Fitting only ever happens
 * through {@link #fit(List)} or {@link #fitSite(Site, List)}; detectors never call it.
 */
@Slf4j
public class BaselineCalculator {

    static final int WORK_START_HOUR = 7;
    static final int WORK_END_HOUR = 18;

    private final Clock clock;

    public BaselineCalculator() {
        this(Clock.systemUTC());
    }

    public BaselineCalculator(Clock clock) {
        this.clock = clock;
    }

    public BaselineSet fit(List<ConsumptionRecord> dataset) {
        if (dataset == null || dataset.isEmpty()) {
            throw new InvalidDatasetException("Cannot fit baselines on an empty dataset");
        }
        log.info("Computing historical statistics over {} records...", dataset.size());
        Map<Site, List<ConsumptionRecord>> bySite = partitionBySite(dataset);
        Map<Site, Baseline> baselines = new LinkedHashMap<>();
        bySite.forEach((site, records) -> baselines.put(site, fitSite(site, records)));
        log.info("Computed baselines for {} sites", baselines.size());
        return BaselineSet.of(baselines);
    }

    public Baseline fitSite(Site site, List<ConsumptionRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new InvalidDatasetException("No records to fit baseline for site " + site);
        }
        List<Double> all = new ArrayList<>(records.size());
        Map<Integer, List<Double>> byHour = new TreeMap<>();
        Map<DayOfWeek, List<Double>> byDay = new EnumMap<>(DayOfWeek.class);
        List<Double> working = new ArrayList<>();
        List<Double> nonWorking = new ArrayList<>();
        List<Double> weekend = new ArrayList<>();
        List<Double> weekday = new ArrayList<>();
        Map<Sector, List<Double>> bySector = new EnumMap<>(Sector.class);

        for (ConsumptionRecord record : records) {
            if (!site.equals(record.getSite())) {
                throw new InvalidDatasetException("Record for site " + record.getSite() + " passed to baseline of " + site);
            }
            double total = requireFiniteTotal(record);
            int hour = record.hour();
            DayOfWeek day = record.dayOfWeek();
            all.add(total);
            byHour.computeIfAbsent(hour, k -> new ArrayList<>()).add(total);
            byDay.computeIfAbsent(day, k -> new ArrayList<>()).add(total);
            if (hour >= WORK_START_HOUR && hour <= WORK_END_HOUR) {
                working.add(total);
            } else {
                nonWorking.add(total);
            }
            if (isWeekendDay(day)) {
                weekend.add(total);
            } else {
                weekday.add(total);
            }
            record.getSectorEnergyKwh().forEach((sector, value) -> {
                if (Double.isFinite(value)) {
                    bySector.computeIfAbsent(sector, k -> new ArrayList<>()).add(value);
                }
            });
        }

        double[] values = Stats.toArray(all);
        double mean = Stats.mean(values);

        Map<Integer, Double> hourlyMean = new TreeMap<>();
        Map<Integer, Double> hourlyStd = new TreeMap<>();
        byHour.forEach((hour, xs) -> {
            hourlyMean.put(hour, Stats.mean(xs));
            hourlyStd.put(hour, Stats.std(xs));
        });
        Map<DayOfWeek, Double> dailyMean = new EnumMap<>(DayOfWeek.class);
        byDay.forEach((day, xs) -> dailyMean.put(day, Stats.mean(xs)));

        Map<Sector, Double> sectorMean = new EnumMap<>(Sector.class);
        Map<Sector, Double> sectorStd = new EnumMap<>(Sector.class);
        bySector.forEach((sector, xs) -> {
            sectorMean.put(sector, Stats.mean(xs));
            sectorStd.put(sector, Stats.std(xs));
        });

        Baseline baseline = Baseline.builder()
                .site(site)
                .sampleCount(values.length)
                .mean(mean)
                .std(Stats.std(values))
                .median(Stats.median(values))
                .p95(Stats.percentile(values, 95))
                .p99(Stats.percentile(values, 99))
                .hourlyMean(hourlyMean)
                .hourlyStd(hourlyStd)
                .dailyMean(dailyMean)
                .workingHoursMean(working.isEmpty() ? mean : Stats.mean(working))
                .nonWorkingMean(nonWorking.isEmpty() ? mean * 0.3 : Stats.mean(nonWorking))
                .weekendMean(weekend.isEmpty() ? mean * 0.4 : Stats.mean(weekend))
                .weekdayMean(weekday.isEmpty() ? mean : Stats.mean(weekday))
                .sectorMean(sectorMean)
                .sectorStd(sectorStd)
                .fittedAt(clock.instant())
                .build();
        log.debug("Baseline site:{} n:{} mean:{} std:{} workingMean:{} weekdayMean:{}",
                site, baseline.getSampleCount(), baseline.getMean(), baseline.getStd(),
                baseline.getWorkingHoursMean(), baseline.getWeekdayMean());
        if (!baseline.hasVariance()) {
            log.warn("Site {} has zero total-energy variance, z-score rules are disabled for it", site);
        }
        return baseline;
    }

    static boolean isWeekendDay(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    /** Groups records by site in encounter order. Null records and non-finite totals are rejected. */
    public static Map<Site, List<ConsumptionRecord>> partitionBySite(List<ConsumptionRecord> dataset) {
        Map<Site, List<ConsumptionRecord>> bySite = new LinkedHashMap<>();
        for (ConsumptionRecord record : dataset) {
            if (record == null) {
                throw new InvalidDatasetException("Dataset contains a null record");
            }
            requireFiniteTotal(record);
            bySite.computeIfAbsent(record.getSite(), k -> new ArrayList<>()).add(record);
        }
        return bySite;
    }

    /**
     * Rejects a dataset holding a null record or a non-finite total energy reading.
     */
    public static void requireValidRecords(List<ConsumptionRecord> dataset) {
        for (ConsumptionRecord record : dataset) {
            if (record == null) {
                throw new InvalidDatasetException("Dataset contains a null record");
            }
            requireFiniteTotal(record);
        }
    }

    public static double requireFiniteTotal(ConsumptionRecord record) {
        double total = record.getTotalEnergyKwh();
        if (!Double.isFinite(total)) {
            throw new InvalidDatasetException("Non-finite total energy at " + record.getTimestamp() + " for site " + record.getSite());
        }
        return total;
    }
}
