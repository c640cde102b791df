package com.ecoenergy.anomaly.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Tag recording which path produced an anomaly. */
@Getter
@RequiredArgsConstructor
public enum DetectionMethod {
    RULES("rules"),
    RULES_REALTIME("rules_realtime"),
    SEASONAL_RESIDUAL("seasonal_residual"),
    OUTLIER_MODEL("outlier_model"),
    ENSEMBLE("ensemble");

    private final String tag;
}
