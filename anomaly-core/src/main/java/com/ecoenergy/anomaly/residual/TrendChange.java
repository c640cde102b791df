package com.ecoenergy.anomaly.residual;

import com.ecoenergy.anomaly.model.Site;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/** Significant acceleration of a site's consumption trend. */
@Value
@Builder
public class TrendChange {

    public enum Direction {
        INCREASING,
        DECREASING
    }

    LocalDateTime timestamp;
    Site site;
    Direction direction;
    double zScore;
    String description;
    String recommendation;
}
