package com.ecoenergy.anomaly.service.services;

import com.ecoenergy.anomaly.model.ConsumptionRecord;
import com.ecoenergy.anomaly.model.Site;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

final class Readings {

    static final Site TUNJA = new Site("Tunja");
    static final Site DUITAMA = new Site("Duitama");
    static final LocalDateTime MONDAY = LocalDateTime.of(2024, 3, 4, 0, 0);

    private Readings() {
    }

    static ConsumptionRecord at(Site site, LocalDateTime timestamp, double kwh) {
        return ConsumptionRecord.builder().site(site).timestamp(timestamp).totalEnergyKwh(kwh).build();
    }

    /** {@code days} of hourly readings with a daily cycle around 100 kWh. */
    static List<ConsumptionRecord> days(Site site, int days) {
        List<ConsumptionRecord> records = new ArrayList<>();
        for (int i = 0; i < days * 24; i++) {
            records.add(at(site, MONDAY.plusHours(i), 100 + 40 * Math.sin(2 * Math.PI * (i % 24 - 6) / 24.0)));
        }
        return records;
    }
}
