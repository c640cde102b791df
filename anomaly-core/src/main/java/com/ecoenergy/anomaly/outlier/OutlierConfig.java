package com.ecoenergy.anomaly.outlier;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

@Value
@Builder(toBuilder = true)
public class OutlierConfig {

    @Builder.Default
    double decisionThreshold = IsolationForestOutlierModel.DEFAULT_DECISION_THRESHOLD;
    /** |score| cutoffs. */
    @Builder.Default
    double criticalCutoff = 0.3;
    @Builder.Default
    double highCutoff = 0.2;
    @Builder.Default
    double mediumCutoff = 0.1;
    /** Columns that are never fed to the model: the target and identifiers. */
    @NonNull
    @Singular
    Set<String> excludedColumns;

    public static OutlierConfig defaults() {
        return OutlierConfig.builder()
                .excludedColumn(CalendarFeatureExtractor.TOTAL_ENERGY)
                .excludedColumn(CalendarFeatureExtractor.SITE_INDEX)
                .excludedColumn("record_id")
                .build();
    }

    public OutlierConfig validate() {
        if (mediumCutoff < 0 || highCutoff < mediumCutoff || criticalCutoff < highCutoff) {
            throw new IllegalArgumentException("Outlier cutoffs must satisfy 0 <= medium <= high <= critical");
        }
        return this;
    }
}
