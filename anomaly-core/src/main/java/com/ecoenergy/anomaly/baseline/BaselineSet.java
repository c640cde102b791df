package com.ecoenergy.anomaly.baseline;

import com.ecoenergy.anomaly.model.Site;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable snapshot of fitted baselines keyed by site.
 */
public final class BaselineSet {

    private static final BaselineSet EMPTY = new BaselineSet(Map.of());

    private final Map<Site, Baseline> baselines;

    private BaselineSet(Map<Site, Baseline> baselines) {
        this.baselines = Collections.unmodifiableMap(new TreeMap<>(baselines));
    }

    public static BaselineSet empty() {
        return EMPTY;
    }

    public static BaselineSet of(Map<Site, Baseline> baselines) {
        return new BaselineSet(baselines);
    }

    public Optional<Baseline> forSite(Site site) {
        return Optional.ofNullable(baselines.get(site));
    }

    /** Copy with {@code baseline} replacing whatever was stored for its site. */
    public BaselineSet withBaseline(Baseline baseline) {
        Map<Site, Baseline> copy = new TreeMap<>(baselines);
        copy.put(baseline.getSite(), baseline);
        return new BaselineSet(copy);
    }

    public Set<Site> sites() {
        return baselines.keySet();
    }

    public Collection<Baseline> all() {
        return baselines.values();
    }

    public boolean isEmpty() {
        return baselines.isEmpty();
    }

    public int size() {
        return baselines.size();
    }
}
