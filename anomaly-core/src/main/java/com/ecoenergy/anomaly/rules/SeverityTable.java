package com.ecoenergy.anomaly.rules;

import com.ecoenergy.anomaly.model.Severity;
import lombok.Value;

/**
 * Monotone cutoffs mapping a deviation ratio (or z-score) to a {@link Severity}. The highest tier
 * whose cutoff is less than or equal to the observed value wins; anything below the medium cutoff
 * is {@link Severity#LOW}.
 */
@Value
public class SeverityTable {

    /** Not consulted by {@link #classify(double)}; rules fire on their own threshold. */
    double low;
    double medium;
    double high;
    double critical;

    public SeverityTable(double low, double medium, double high, double critical) {
        if (!(low <= medium && medium <= high && high <= critical)) {
            throw new IllegalArgumentException(String.format(
                    "Severity cutoffs must be non-decreasing: low=%s medium=%s high=%s critical=%s",
                    low, medium, high, critical));
        }
        this.low = low;
        this.medium = medium;
        this.high = high;
        this.critical = critical;
    }

    public static SeverityTable of(double low, double medium, double high, double critical) {
        return new SeverityTable(low, medium, high, critical);
    }

    public Severity classify(double value) {
        if (value >= critical) {
            return Severity.CRITICAL;
        } else if (value >= high) {
            return Severity.HIGH;
        } else if (value >= medium) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
