package com.ecoenergy.anomaly.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Members of the batch ensemble. The name is what weights and logs are keyed by. */
@Getter
@RequiredArgsConstructor
public enum DetectorKind {
    RULES("rules"),
    RESIDUAL("residual"),
    OUTLIER_MODEL("outlier_model");

    private final String detectorName;

    public static DetectorKind fromName(String name) {
        for (DetectorKind kind : values()) {
            if (kind.detectorName.equalsIgnoreCase(name) || kind.name().equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown detector: " + name);
    }
}
