package com.ecoenergy.anomaly.ensemble;

import com.ecoenergy.anomaly.model.DetectorKind;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class MergerConfig {

    public static final double DEFAULT_WEIGHT = 0.33;

    /** Distinct detectors that must agree on a (site, hour) bucket. */
    @Builder.Default
    int minConsensus = 2;
    @Builder.Default
    Map<DetectorKind, Double> weights = defaultWeights();
    /** Used for detectors with no configured weight. */
    @Builder.Default
    double defaultWeight = DEFAULT_WEIGHT;

    public static MergerConfig defaults() {
        return MergerConfig.builder().build();
    }

    public double weightOf(DetectorKind kind) {
        Double weight = weights.get(kind);
        return weight == null ? defaultWeight : weight;
    }

    public MergerConfig validate() {
        if (minConsensus < 1) {
            throw new IllegalArgumentException("Minimum consensus must be at least 1, was " + minConsensus);
        }
        if (defaultWeight < 0) {
            throw new IllegalArgumentException("Default weight must not be negative");
        }
        weights.forEach((kind, weight) -> {
            if (weight == null || weight < 0 || !Double.isFinite(weight)) {
                throw new IllegalArgumentException("Invalid weight for detector " + kind.getDetectorName() + ": " + weight);
            }
        });
        return this;
    }

    private static Map<DetectorKind, Double> defaultWeights() {
        Map<DetectorKind, Double> weights = new EnumMap<>(DetectorKind.class);
        weights.put(DetectorKind.RULES, 0.4);
        weights.put(DetectorKind.RESIDUAL, 0.3);
        weights.put(DetectorKind.OUTLIER_MODEL, 0.3);
        return Collections.unmodifiableMap(weights);
    }
}
