package com.ecoenergy.anomaly;

import com.ecoenergy.anomaly.model.Site;

/** Detection was requested for a site that has no fitted baseline. */
public class BaselineUnavailableException extends AnomalyDetectionException {

    private final transient Site site;

    public BaselineUnavailableException(Site site) {
        super("No fitted baseline for site " + site);
        this.site = site;
    }

    public Site getSite() {
        return site;
    }
}
