package com.ecoenergy.anomaly.service.services;

import com.ecoenergy.anomaly.InvalidDatasetException;
import com.ecoenergy.anomaly.UnknownSiteException;
import com.ecoenergy.anomaly.baseline.BaselineSet;
import com.ecoenergy.anomaly.ensemble.AnomalySummary;
import com.ecoenergy.anomaly.ensemble.EnsembleAnomalyDetector;
import com.ecoenergy.anomaly.ensemble.EnsembleResult;
import com.ecoenergy.anomaly.model.ConsumptionRecord;
import com.ecoenergy.anomaly.model.DetectorKind;
import com.ecoenergy.anomaly.model.MergedAnomaly;
import com.ecoenergy.anomaly.model.Severity;
import com.ecoenergy.anomaly.model.Site;
import com.ecoenergy.anomaly.model.SiteRegistry;
import com.ecoenergy.anomaly.realtime.RealTimeDetector;
import com.ecoenergy.anomaly.realtime.RealTimeResult;
import com.ecoenergy.anomaly.residual.SeasonalProfile;
import com.ecoenergy.anomaly.residual.SeasonalResidualDetector;
import com.ecoenergy.anomaly.residual.TrendChange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for callers: batch ensemble detection, the single-record path and the secondary
 * residual analyses, all against the current baseline snapshot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyDetectionService {

    private final SiteRegistry siteRegistry;
    private final BaselineService baselineService;
    private final EnsembleAnomalyDetector ensembleAnomalyDetector;
    private final RealTimeDetector realTimeDetector;
    private final SeasonalResidualDetector seasonalResidualDetector;

    public EnsembleResult detect(List<ConsumptionRecord> dataset, Severity minSeverity, Set<DetectorKind> detectors) {
        requireKnownSites(dataset);
        BaselineSet baselines = baselineService.current();
        if (baselines.isEmpty()) {
            log.warn("No baselines fitted yet, baseline-dependent detectors will skip every site");
        }
        EnsembleResult result = ensembleAnomalyDetector.detect(dataset, baselines, minSeverity, detectors);
        if (result.isDegraded()) {
            log.warn("Detection ran degraded, missing detectors:{}", result.getDegradedDetectors());
        }
        return result;
    }

    /**
     * Same as {@link #detect(List, Severity, Set)} with severity and detectors given by their codes.
     * A null severity keeps everything; a null or empty detector list runs all of them.
     */
    public EnsembleResult detect(List<ConsumptionRecord> dataset, String minSeverity, Collection<String> detectors) {
        Severity severity = minSeverity == null || minSeverity.isBlank() ? null : Severity.fromCode(minSeverity);
        Set<DetectorKind> kinds = EnumSet.noneOf(DetectorKind.class);
        if (detectors != null) {
            detectors.forEach(name -> kinds.add(DetectorKind.fromName(name)));
        }
        return detect(dataset, severity, kinds);
    }

    public RealTimeResult detectRealtime(ConsumptionRecord record) {
        requireKnownSite(record.getSite());
        return realTimeDetector.detect(record, baselineService.current());
    }

    public AnomalySummary summarize(List<MergedAnomaly> anomalies) {
        return anomalies == null ? AnomalySummary.empty() : AnomalySummary.of(anomalies);
    }

    public List<TrendChange> trendChanges(List<ConsumptionRecord> dataset) {
        requireKnownSites(dataset);
        return seasonalResidualDetector.detectTrendChanges(dataset);
    }

    public Optional<SeasonalProfile> seasonalProfile(List<ConsumptionRecord> dataset, String siteCode) {
        Site site = siteRegistry.resolve(siteCode);
        return seasonalResidualDetector.seasonalProfile(dataset, site);
    }

    private void requireKnownSites(List<ConsumptionRecord> dataset) {
        if (dataset == null || dataset.isEmpty()) {
            throw new InvalidDatasetException("Dataset must contain at least one record");
        }
        dataset.stream().map(ConsumptionRecord::getSite).distinct().forEach(this::requireKnownSite);
    }

    private void requireKnownSite(Site site) {
        if (!siteRegistry.contains(site)) {
            throw new UnknownSiteException(site.getCode());
        }
    }
}
