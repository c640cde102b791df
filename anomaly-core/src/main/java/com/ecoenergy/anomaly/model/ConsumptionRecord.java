package com.ecoenergy.anomaly.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One hourly reading for a site. Immutable.
 */
@Value
public class ConsumptionRecord {

    LocalDateTime timestamp;
    Site site;
    Map<Sector, Double> sectorEnergyKwh;
    double totalEnergyKwh;
    Double waterLiters;
    Double exteriorTemperatureC;
    /** Occupancy in percent (0-100), absent when the sensor did not report. */
    Double occupancyPct;
    boolean weekend;
    boolean holiday;
    boolean midtermWeek;
    boolean finalsWeek;
    String academicPeriod;

    @Builder(toBuilder = true)
    private ConsumptionRecord(@NonNull LocalDateTime timestamp,
                              @NonNull Site site,
                              Map<Sector, Double> sectorEnergyKwh,
                              double totalEnergyKwh,
                              Double waterLiters,
                              Double exteriorTemperatureC,
                              Double occupancyPct,
                              boolean weekend,
                              boolean holiday,
                              boolean midtermWeek,
                              boolean finalsWeek,
                              String academicPeriod) {
        this.timestamp = timestamp;
        this.site = site;
        Map<Sector, Double> sectors = new EnumMap<>(Sector.class);
        if (sectorEnergyKwh != null) {
            sectorEnergyKwh.forEach((sector, value) -> {
                if (sector != Sector.TOTAL && value != null) {
                    sectors.put(sector, value);
                }
            });
        }
        this.sectorEnergyKwh = Collections.unmodifiableMap(sectors);
        this.totalEnergyKwh = totalEnergyKwh;
        this.waterLiters = waterLiters;
        this.exteriorTemperatureC = exteriorTemperatureC;
        this.occupancyPct = occupancyPct;
        this.weekend = weekend;
        this.holiday = holiday;
        this.midtermWeek = midtermWeek;
        this.finalsWeek = finalsWeek;
        this.academicPeriod = academicPeriod;
    }

    public int hour() {
        return timestamp.getHour();
    }

    public DayOfWeek dayOfWeek() {
        return timestamp.getDayOfWeek();
    }

    public Double sectorEnergy(Sector sector) {
        return sectorEnergyKwh.get(sector);
    }
}
