package com.ecoenergy.anomaly.model;

import com.ecoenergy.anomaly.UnknownSiteException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Closed set of sites known to the deployment. Lookups are case-insensitive on the code.
 */
public final class SiteRegistry {

    public static final List<String> DEFAULT_SITES = List.of("Tunja", "Duitama", "Sogamoso", "Chiquinquira");

    private final Map<String, Site> sites;

    private SiteRegistry(Map<String, Site> sites) {
        this.sites = Collections.unmodifiableMap(sites);
    }

    public static SiteRegistry of(Collection<String> codes) {
        if (codes == null || codes.isEmpty()) {
            throw new IllegalArgumentException("Site registry needs at least one site");
        }
        Map<String, Site> sites = new LinkedHashMap<>();
        for (String code : codes) {
            if (code == null || code.isBlank()) {
                throw new IllegalArgumentException("Site code must not be blank");
            }
            sites.putIfAbsent(key(code), new Site(code.trim()));
        }
        return new SiteRegistry(sites);
    }

    public static SiteRegistry defaults() {
        return of(DEFAULT_SITES);
    }

    public Site resolve(String code) {
        Site site = code == null ? null : sites.get(key(code));
        if (site == null) {
            throw new UnknownSiteException(code);
        }
        return site;
    }

    public boolean contains(Site site) {
        return site != null && site.equals(sites.get(key(site.getCode())));
    }

    public Collection<Site> all() {
        return sites.values();
    }

    private static String key(String code) {
        return code.trim().toLowerCase(Locale.ROOT);
    }
}
