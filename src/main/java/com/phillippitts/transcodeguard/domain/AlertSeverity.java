package com.phillippitts.transcodeguard.domain;

/**
 * Alert severity, ordered from least to most severe.
 */
public enum AlertSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public boolean isHigherThan(AlertSeverity other) {
        return compareTo(other) > 0;
    }
}
