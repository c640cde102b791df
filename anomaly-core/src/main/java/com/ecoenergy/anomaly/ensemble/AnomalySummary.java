package com.ecoenergy.anomaly.ensemble;

import com.ecoenergy.anomaly.model.AnomalyType;
import com.ecoenergy.anomaly.model.DetectionMethod;
import com.ecoenergy.anomaly.model.MergedAnomaly;
import com.ecoenergy.anomaly.model.Severity;
import com.ecoenergy.anomaly.model.Site;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counts and totals over a list of anomalies. Anomalies are counted by their primary type.
 */
@Value
public class AnomalySummary {

    long total;
    Map<Severity, Long> bySeverity;
    Map<AnomalyType, Long> byType;
    Map<Site, Long> bySite;
    Map<DetectionMethod, Long> byDetectionMethod;
    double totalPotentialSavingsKwh;
    double avgDeviationPct;

    public static AnomalySummary of(Collection<MergedAnomaly> anomalies) {
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        Map<AnomalyType, Long> byType = new EnumMap<>(AnomalyType.class);
        Map<Site, Long> bySite = new TreeMap<>();
        Map<DetectionMethod, Long> byMethod = new EnumMap<>(DetectionMethod.class);
        double savings = 0;
        double deviation = 0;
        for (MergedAnomaly anomaly : anomalies) {
            bySeverity.merge(anomaly.getSeverity(), 1L, Long::sum);
            byType.merge(anomaly.getPrimaryType(), 1L, Long::sum);
            bySite.merge(anomaly.getSite(), 1L, Long::sum);
            byMethod.merge(anomaly.getDetectionMethod(), 1L, Long::sum);
            savings += anomaly.getPotentialSavingsKwh();
            deviation += anomaly.getDeviationPct();
        }
        int n = anomalies.size();
        return new AnomalySummary(n,
                Collections.unmodifiableMap(bySeverity),
                Collections.unmodifiableMap(byType),
                Collections.unmodifiableMap(bySite),
                Collections.unmodifiableMap(byMethod),
                savings,
                n == 0 ? 0 : deviation / n);
    }

    public static AnomalySummary empty() {
        return of(List.of());
    }
}
