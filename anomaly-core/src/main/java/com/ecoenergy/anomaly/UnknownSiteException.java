package com.ecoenergy.anomaly;

public class UnknownSiteException extends AnomalyDetectionException {

    public UnknownSiteException(String code) {
        super("Unknown site: " + code);
    }
}
