package com.ecoenergy.anomaly;

public class ModelUnavailableException extends AnomalyDetectionException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
