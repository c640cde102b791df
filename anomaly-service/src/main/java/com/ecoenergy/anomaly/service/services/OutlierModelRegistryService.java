package com.ecoenergy.anomaly.service.services;

import com.ecoenergy.anomaly.ModelUnavailableException;
import com.ecoenergy.anomaly.outlier.IsolationForestOutlierModel;
import com.ecoenergy.anomaly.outlier.OutlierModel;
import com.ecoenergy.anomaly.service.config.AnomalyProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import smile.anomaly.IsolationForest;

import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads the pretrained isolation forest written by the offline training job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutlierModelRegistryService {

    private final AnomalyProperties properties;

    /** Empty when no model is configured or the file cannot be read; the ensemble then runs without it. */
    public Optional<OutlierModel> loadModel() {
        AnomalyProperties.Outlier outlier = properties.outlier();
        if (!outlier.modelConfigured()) {
            log.info("No outlier model configured, outlier detection disabled");
            return Optional.empty();
        }
        try {
            IsolationForest forest = readForest(Path.of(outlier.modelPath()));
            double threshold = outlier.toOutlierConfig().getDecisionThreshold();
            log.info("Outlier model loaded from {} with decision threshold {}", outlier.modelPath(), threshold);
            return Optional.of(new IsolationForestOutlierModel(forest, threshold));
        } catch (ModelUnavailableException e) {
            log.warn("Outlier model unavailable, continuing without it: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    public IsolationForest readForest(Path path) {
        if (!Files.isReadable(path)) {
            throw new ModelUnavailableException("Model file not readable: " + path);
        }
        try (InputStream in = Files.newInputStream(path);
             ObjectInputStream ois = new ObjectInputStream(in)) {
            Object model = ois.readObject();
            if (!(model instanceof IsolationForest forest)) {
                throw new ModelUnavailableException("Model file " + path + " does not hold an IsolationForest but "
                        + (model == null ? "null" : model.getClass().getName()));
            }
            return forest;
        } catch (IOException | ClassNotFoundException e) {
            throw new ModelUnavailableException("Cannot deserialize model from " + path, e);
        }
    }
}
