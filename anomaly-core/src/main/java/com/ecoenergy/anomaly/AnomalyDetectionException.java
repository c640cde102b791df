package com.ecoenergy.anomaly;

/**
 * Root of the failures raised by the detection core.
 */
public class AnomalyDetectionException extends RuntimeException {

    public AnomalyDetectionException(String message) {
        super(message);
    }

    public AnomalyDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
