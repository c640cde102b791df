package com.ecoenergy.anomaly.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum AnomalyType {
    OFF_HOURS("off_hours_usage"),
    WEEKEND("weekend_anomaly"),
    SPIKE("consumption_spike"),
    OCCUPANCY_IMBALANCE("low_occupancy_high_consumption"),
    HOLIDAY("holiday_consumption"),
    VACATION_HIGH("academic_vacation_high"),
    RESIDUAL_SPIKE("residual_spike"),
    RESIDUAL_DROP("residual_drop"),
    STATISTICAL_OUTLIER("statistical_outlier");

    private final String code;

    public static AnomalyType fromCode(String code) {
        for (AnomalyType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown anomaly type: " + code);
    }
}
