package com.phillippitts.transcodeguard.service.policy;

import com.phillippitts.transcodeguard.domain.ResourceSnapshot;
import com.phillippitts.transcodeguard.domain.ThermalState;

import java.util.Objects;

/**
 * Named policy rule: when {@code kind} measured on a snapshot satisfies
 * {@code comparator} against {@code limit}, the rule yields {@code decision}.
 */
public record Threshold(
        ResourceKind kind,
        ThresholdComparator comparator,
        double limit,
        DecisionType decision
) {
    public Threshold {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(comparator, "comparator");
        Objects.requireNonNull(decision, "decision");
        if (Double.isNaN(limit)) {
            throw new IllegalArgumentException("limit must be a number");
        }
        if (decision == DecisionType.CONTINUE) {
            throw new IllegalArgumentException("A threshold cannot resolve to CONTINUE");
        }
    }

    public boolean isTrippedBy(ResourceSnapshot snapshot) {
        return kind.applies(snapshot) && comparator.test(kind.measure(snapshot), limit);
    }

    public static Threshold thermalCeiling(ThermalState atOrAbove) {
        return new Threshold(ResourceKind.THERMAL_CEILING, ThresholdComparator.GREATER_THAN_OR_EQUAL,
                atOrAbove.ordinal(), DecisionType.ABORT);
    }

    public static Threshold thermalThrottle(ThermalState atOrAbove) {
        return new Threshold(ResourceKind.THERMAL_THROTTLE, ThresholdComparator.GREATER_THAN_OR_EQUAL,
                atOrAbove.ordinal(), DecisionType.THROTTLE);
    }

    public static Threshold batteryMinimum(double fraction) {
        return new Threshold(ResourceKind.BATTERY, ThresholdComparator.LESS_THAN, fraction, DecisionType.PAUSE);
    }

    public static Threshold storageMinimum(long bytes) {
        return new Threshold(ResourceKind.STORAGE, ThresholdComparator.LESS_THAN, bytes, DecisionType.ABORT);
    }

    public static Threshold memoryMinimum(long bytes) {
        return new Threshold(ResourceKind.MEMORY, ThresholdComparator.LESS_THAN, bytes, DecisionType.ALERT);
    }
}
