package com.ecoenergy.anomaly.ensemble;

import com.ecoenergy.anomaly.model.DetectorKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed set of batch detectors, one per {@link DetectorKind}.
 */
@Slf4j
public class DetectorRegistry {

    private final Map<DetectorKind, BatchDetector> detectors = new EnumMap<>(DetectorKind.class);
    private final Set<DetectorKind> reportedUnavailable = ConcurrentHashMap.newKeySet();

    public DetectorRegistry(List<? extends BatchDetector> detectors) {
        for (BatchDetector detector : detectors) {
            if (this.detectors.putIfAbsent(detector.kind(), detector) != null) {
                throw new IllegalArgumentException("Duplicate detector: " + detector.kind().getDetectorName());
            }
        }
    }

    public Optional<BatchDetector> get(DetectorKind kind) {
        return Optional.ofNullable(detectors.get(kind));
    }

    public List<BatchDetector> all() {
        return Collections.unmodifiableList(new ArrayList<>(detectors.values()));
    }

    /** Registered detectors whose capability is present. Unavailable ones are logged the first time. */
    public List<BatchDetector> active() {
        List<BatchDetector> active = new ArrayList<>();
        for (BatchDetector detector : detectors.values()) {
            if (detector.available()) {
                active.add(detector);
            } else if (reportedUnavailable.add(detector.kind())) {
                log.warn("Detector {} is unavailable and will be skipped", detector.kind().getDetectorName());
            }
        }
        return active;
    }
}
