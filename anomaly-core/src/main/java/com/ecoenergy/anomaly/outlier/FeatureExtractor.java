package com.ecoenergy.anomaly.outlier;

import com.ecoenergy.anomaly.model.ConsumptionRecord;

import java.util.List;

/** Turns records into the feature table an {@link OutlierModel} was trained on. */
public interface FeatureExtractor {

    FeatureMatrix extract(List<ConsumptionRecord> records);
}
