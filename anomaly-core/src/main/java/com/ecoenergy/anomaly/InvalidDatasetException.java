package com.ecoenergy.anomaly;

/** The input dataset cannot be used: empty, or holding malformed records. */
public class InvalidDatasetException extends AnomalyDetectionException {

    public InvalidDatasetException(String message) {
        super(message);
    }
}
