package com.ecoenergy.anomaly.service;

import com.ecoenergy.anomaly.ensemble.BatchDetector;
import com.ecoenergy.anomaly.ensemble.ConsensusMerger;
import com.ecoenergy.anomaly.ensemble.DetectorRegistry;
import com.ecoenergy.anomaly.model.DetectorKind;
import com.ecoenergy.anomaly.model.SiteRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "anomaly.outlier.model-path=")
class AnomalyServiceApplicationTest {

    @Autowired
    private DetectorRegistry detectorRegistry;

    @Autowired
    private ConsensusMerger consensusMerger;

    @Autowired
    private SiteRegistry siteRegistry;

    @Test
    void contextLoadsWithoutAnOutlierModel() {
        assertThat(detectorRegistry.all()).hasSize(3);
        assertThat(detectorRegistry.active())
                .extracting(BatchDetector::kind)
                .containsExactly(DetectorKind.RULES, DetectorKind.RESIDUAL);
        assertThat(consensusMerger.config().getMinConsensus()).isEqualTo(2);
        assertThat(siteRegistry.all()).hasSize(4);
    }
}
