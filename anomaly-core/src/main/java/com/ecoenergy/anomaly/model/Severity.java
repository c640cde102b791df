package com.ecoenergy.anomaly.model;

import java.util.Locale;

/**
 * Ordinal severity tier. Declaration order is the ranking: LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean atLeast(Severity other) {
        return other == null || this.ordinal() >= other.ordinal();
    }

    public static Severity max(Severity a, Severity b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Severity fromCode(String code) {
        for (Severity severity : values()) {
            if (severity.code().equalsIgnoreCase(code)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + code);
    }
}
