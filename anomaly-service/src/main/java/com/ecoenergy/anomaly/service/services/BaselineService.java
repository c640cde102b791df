package com.ecoenergy.anomaly.service.services;

import com.ecoenergy.anomaly.BaselineUnavailableException;
import com.ecoenergy.anomaly.baseline.Baseline;
import com.ecoenergy.anomaly.baseline.BaselineCalculator;
import com.ecoenergy.anomaly.baseline.BaselineSet;
import com.ecoenergy.anomaly.model.ConsumptionRecord;
import com.ecoenergy.anomaly.model.Site;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current baseline snapshot. Readers always see a complete snapshot; fits swap in a new one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BaselineService {

    private final BaselineCalculator baselineCalculator;
    private final AtomicReference<BaselineSet> snapshot = new AtomicReference<>(BaselineSet.empty());

    public BaselineSet fit(List<ConsumptionRecord> dataset) {
        BaselineSet fitted = baselineCalculator.fit(dataset);
        snapshot.set(fitted);
        log.info("Baselines replaced, sites:{}", fitted.sites());
        return fitted;
    }

    public Baseline refit(Site site, List<ConsumptionRecord> records) {
        Baseline baseline = baselineCalculator.fitSite(site, records);
        snapshot.updateAndGet(current -> current.withBaseline(baseline));
        log.info("Baseline refitted for site {} over {} records", site, records.size());
        return baseline;
    }

    public BaselineSet current() {
        return snapshot.get();
    }

    public Baseline baselineFor(Site site) {
        return snapshot.get().forSite(site).orElseThrow(() -> new BaselineUnavailableException(site));
    }
}
