package com.ecoenergy.anomaly.service.config;

import com.ecoenergy.anomaly.baseline.BaselineCalculator;
import com.ecoenergy.anomaly.ensemble.BatchDetector;
import com.ecoenergy.anomaly.ensemble.ConsensusMerger;
import com.ecoenergy.anomaly.ensemble.DetectorRegistry;
import com.ecoenergy.anomaly.ensemble.EnsembleAnomalyDetector;
import com.ecoenergy.anomaly.model.SiteRegistry;
import com.ecoenergy.anomaly.outlier.CalendarFeatureExtractor;
import com.ecoenergy.anomaly.outlier.FeatureExtractor;
import com.ecoenergy.anomaly.outlier.OutlierModelDetector;
import com.ecoenergy.anomaly.realtime.RealTimeDetector;
import com.ecoenergy.anomaly.residual.MovingAverageDecomposer;
import com.ecoenergy.anomaly.residual.SeasonalResidualDetector;
import com.ecoenergy.anomaly.rules.RuleBasedDetector;
import com.ecoenergy.anomaly.service.services.OutlierModelRegistryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@EnableConfigurationProperties(AnomalyProperties.class)
public class DetectionConfig {

    @Bean
    SiteRegistry siteRegistry(AnomalyProperties properties) {
        return properties.siteRegistry();
    }

    @Bean
    BaselineCalculator baselineCalculator() {
        return new BaselineCalculator();
    }

    @Bean
    RuleBasedDetector ruleBasedDetector(AnomalyProperties properties) {
        return new RuleBasedDetector(properties.rules().toRuleConfig());
    }

    @Bean
    SeasonalResidualDetector seasonalResidualDetector(AnomalyProperties properties) {
        return new SeasonalResidualDetector(new MovingAverageDecomposer(), properties.residual().toResidualConfig());
    }

    @Bean
    FeatureExtractor featureExtractor(SiteRegistry siteRegistry) {
        return new CalendarFeatureExtractor(siteRegistry);
    }

    @Bean
    OutlierModelDetector outlierModelDetector(OutlierModelRegistryService modelRegistryService,
                                              FeatureExtractor featureExtractor,
                                              AnomalyProperties properties) {
        return new OutlierModelDetector(modelRegistryService.loadModel().orElse(null),
                featureExtractor, properties.outlier().toOutlierConfig());
    }

    @Bean
    DetectorRegistry detectorRegistry(RuleBasedDetector rules,
                                      SeasonalResidualDetector residual,
                                      OutlierModelDetector outlier) {
        List<BatchDetector> detectors = List.of(rules, residual, outlier);
        return new DetectorRegistry(detectors);
    }

    @Bean
    ConsensusMerger consensusMerger(AnomalyProperties properties) {
        return new ConsensusMerger(properties.ensemble().toMergerConfig());
    }

    @Bean(destroyMethod = "shutdown")
    ExecutorService detectorExecutor(AnomalyProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.ensemble().threads(), runnable -> {
            Thread thread = new Thread(runnable, "detector-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    EnsembleAnomalyDetector ensembleAnomalyDetector(DetectorRegistry registry,
                                                    ConsensusMerger merger,
                                                    ExecutorService detectorExecutor) {
        return new EnsembleAnomalyDetector(registry, merger, detectorExecutor);
    }

    @Bean
    RealTimeDetector realTimeDetector(RuleBasedDetector ruleBasedDetector) {
        return new RealTimeDetector(ruleBasedDetector);
    }

    @Bean
    ApplicationRunner reportDetectors(DetectorRegistry registry, SiteRegistry siteRegistry) {
        return args -> log.info("Anomaly detection ready, sites:{} active detectors:{}",
                siteRegistry.all(),
                registry.active().stream().map(detector -> detector.kind().getDetectorName()).toList());
    }
}
