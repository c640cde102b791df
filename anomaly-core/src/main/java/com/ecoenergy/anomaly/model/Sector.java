package com.ecoenergy.anomaly.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

@Getter
@RequiredArgsConstructor
public enum Sector {
    DINING("dining"),
    CLASSROOMS("classrooms"),
    LABORATORIES("laboratories"),
    AUDITORIUMS("auditoriums"),
    OFFICES("offices"),
    /** Whole-site aggregate. */
    TOTAL("total");

    private final String code;

    /** The metered zones, i.e. everything except {@link #TOTAL}. */
    public static Set<Sector> zones() {
        return EnumSet.range(DINING, OFFICES);
    }
}
