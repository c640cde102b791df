package com.ecoenergy.anomaly.outlier;

import com.ecoenergy.anomaly.model.ConsumptionRecord;
import com.ecoenergy.anomaly.model.Sector;
import com.ecoenergy.anomaly.model.Site;
import com.ecoenergy.anomaly.model.SiteRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Calendar, weather, occupancy and sector features. Cyclical fields are encoded as sin/cos pairs.
 * Missing optional readings become NaN and are zeroed by the detector.
 */
public class CalendarFeatureExtractor implements FeatureExtractor {

    public static final String TOTAL_ENERGY = "total_energy_kwh";
    public static final String SITE_INDEX = "site_index";

    private final SiteRegistry siteRegistry;
    private final List<String> columns;

    public CalendarFeatureExtractor(SiteRegistry siteRegistry) {
        this.siteRegistry = siteRegistry;
        List<String> names = new ArrayList<>(List.of(
                "hour_sin", "hour_cos", "day_sin", "day_cos", "month_sin", "month_cos",
                "temperature_c", "occupancy_pct",
                "is_weekend", "is_holiday", "is_midterm_week", "is_finals_week"));
        for (Sector sector : Sector.zones()) {
            names.add("energy_" + sector.getCode() + "_kwh");
        }
        names.add("water_liters");
        names.add(TOTAL_ENERGY);
        names.add(SITE_INDEX);
        this.columns = List.copyOf(names);
    }

    public CalendarFeatureExtractor() {
        this(SiteRegistry.defaults());
    }

    @Override
    public FeatureMatrix extract(List<ConsumptionRecord> records) {
        List<Site> sites = new ArrayList<>(siteRegistry.all());
        double[][] rows = new double[records.size()][];
        for (int i = 0; i < rows.length; i++) {
            ConsumptionRecord record = records.get(i);
            double[] row = new double[columns.size()];
            int c = 0;
            double hour = 2 * Math.PI * record.hour() / 24.0;
            double day = 2 * Math.PI * (record.dayOfWeek().getValue() - 1) / 7.0;
            double month = 2 * Math.PI * (record.getTimestamp().getMonthValue() - 1) / 12.0;
            row[c++] = Math.sin(hour);
            row[c++] = Math.cos(hour);
            row[c++] = Math.sin(day);
            row[c++] = Math.cos(day);
            row[c++] = Math.sin(month);
            row[c++] = Math.cos(month);
            row[c++] = orNaN(record.getExteriorTemperatureC());
            row[c++] = orNaN(record.getOccupancyPct());
            row[c++] = flag(record.isWeekend());
            row[c++] = flag(record.isHoliday());
            row[c++] = flag(record.isMidtermWeek());
            row[c++] = flag(record.isFinalsWeek());
            for (Sector sector : Sector.zones()) {
                row[c++] = orNaN(record.sectorEnergy(sector));
            }
            row[c++] = orNaN(record.getWaterLiters());
            row[c++] = record.getTotalEnergyKwh();
            row[c] = sites.indexOf(record.getSite());
            rows[i] = row;
        }
        return new FeatureMatrix(columns, rows);
    }

    public List<String> columns() {
        return columns;
    }

    private static double orNaN(Double value) {
        return value == null ? Double.NaN : value;
    }

    private static double flag(boolean value) {
        return value ? 1.0 : 0.0;
    }
}
