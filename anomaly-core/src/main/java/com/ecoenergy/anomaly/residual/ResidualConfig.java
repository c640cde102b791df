package com.ecoenergy.anomaly.residual;

import com.ecoenergy.anomaly.rules.SeverityTable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ResidualConfig {

    /** Samples per seasonal cycle; 24 for hourly data with a daily cycle. */
    @Builder.Default
    int seasonalPeriod = 24;
    @Builder.Default
    double zScoreThreshold = 3.0;
    /** Graded on |z|. */
    @NonNull
    @Builder.Default
    SeverityTable severity = SeverityTable.of(3.0, 3.5, 4.0, 5.0);
    @Builder.Default
    double trendZScoreThreshold = 3.0;
    /** Minimum length, in samples, of each half of the series for trend-change detection. */
    @Builder.Default
    int trendWindow = 168;

    public static ResidualConfig defaults() {
        return ResidualConfig.builder().build();
    }

    public ResidualConfig validate() {
        if (seasonalPeriod < 2) {
            throw new IllegalArgumentException("Seasonal period must be at least 2");
        }
        if (zScoreThreshold <= 0 || trendZScoreThreshold <= 0) {
            throw new IllegalArgumentException("Residual z-score thresholds must be positive");
        }
        if (trendWindow < 1) {
            throw new IllegalArgumentException("Trend window must be positive");
        }
        return this;
    }
}
