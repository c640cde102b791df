package com.ecoenergy.anomaly.residual;

import com.ecoenergy.anomaly.model.Site;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/** Typical daily shape of a site's consumption, taken from the seasonal component. */
@Value
@Builder
public class SeasonalProfile {

    Site site;
    Map<Integer, Double> hourlyPattern;
    int peakHour;
    double peakValue;
    int troughHour;
    double troughValue;
    double amplitude;
    double meanTrend;
}
