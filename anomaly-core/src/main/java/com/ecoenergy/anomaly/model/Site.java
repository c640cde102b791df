package com.ecoenergy.anomaly.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Monitored campus. Instances are handed out by {@link SiteRegistry}, which is the only place
 * that validates codes.
 */
@Value
public class Site implements Comparable<Site> {

    @NonNull
    String code;

    @Override
    public int compareTo(Site other) {
        return code.compareTo(other.code);
    }

    @Override
    public String toString() {
        return code;
    }
}
