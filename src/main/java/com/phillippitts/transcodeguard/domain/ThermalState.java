package com.phillippitts.transcodeguard.domain;

import java.util.Locale;

/**
 * Device thermal state, ordered from coolest to hottest.
 */
public enum ThermalState {
    NOMINAL,
    FAIR,
    SERIOUS,
    CRITICAL,
    EMERGENCY;

    public boolean isAtLeast(ThermalState other) {
        return compareTo(other) >= 0;
    }

    /**
     * Parses a case-insensitive name; unknown values map to {@link #NOMINAL}.
     */
    public static ThermalState parse(String raw) {
        if (raw == null) {
            return NOMINAL;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NOMINAL;
        }
    }
}
