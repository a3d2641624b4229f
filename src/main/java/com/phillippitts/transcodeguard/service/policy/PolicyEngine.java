package com.phillippitts.transcodeguard.service.policy;

import com.phillippitts.transcodeguard.domain.Alert;
import com.phillippitts.transcodeguard.domain.AlertSeverity;
import com.phillippitts.transcodeguard.domain.JobId;
import com.phillippitts.transcodeguard.domain.JobState;
import com.phillippitts.transcodeguard.domain.ResourceSnapshot;
import com.phillippitts.transcodeguard.domain.ThermalState;
import com.phillippitts.transcodeguard.util.ByteSizes;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps a resource snapshot and the active thresholds to an ordered list of {@link Decision}s.
 *
 * <p>Rules are checked in {@link ResourceKind} order. The first tripped rule with an actionable
 * decision becomes the primary decision; every other tripped rule is reported as an ALERT
 * decision. With nothing tripped the primary decision is CONTINUE. When no job is active the
 * primary decision is downgraded to ALERT since there is nothing to act on.
 *
 * <p>Besides the threshold set, the only state is alert de-duplication. Threshold changes take
 * effect on the next evaluation.
 *
 * <p><b>Thread Safety:</b> not thread-safe. The conversion coordinator serializes every call.
 */
public class PolicyEngine {

    private final Map<ResourceKind, Threshold> thresholds = new EnumMap<>(ResourceKind.class);
    private final AlertDeduplicator deduplicator;

    public PolicyEngine(Collection<Threshold> initialThresholds, Duration alertCooldown) {
        Objects.requireNonNull(alertCooldown, "alertCooldown");
        this.deduplicator = new AlertDeduplicator(alertCooldown);
        for (Threshold t : initialThresholds) {
            thresholds.put(t.kind(), t);
        }
    }

    /**
     * Installs {@code threshold} for {@code kind}, replacing any existing rule for that kind.
     *
     * @throws IllegalArgumentException if the threshold is for a different kind
     */
    public void setThreshold(ResourceKind kind, Threshold threshold) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(threshold, "threshold");
        if (threshold.kind() != kind) {
            throw new IllegalArgumentException("Threshold kind " + threshold.kind() + " does not match " + kind);
        }
        thresholds.put(kind, threshold);
    }

    /**
     * Removes the rule for {@code kind}.
     *
     * @return the removed rule, if there was one
     */
    public Optional<Threshold> clearThreshold(ResourceKind kind) {
        Threshold removed = thresholds.remove(Objects.requireNonNull(kind, "kind"));
        deduplicator.clear(kind.alertKind());
        return Optional.ofNullable(removed);
    }

    public Map<ResourceKind, Threshold> thresholds() {
        return Collections.unmodifiableMap(new EnumMap<>(thresholds));
    }

    /**
     * Computes decisions for {@code snapshot} without touching de-duplication state.
     */
    public List<Decision> assess(ResourceSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        List<Threshold> tripped = tripped(snapshot);
        if (tripped.isEmpty()) {
            return List.of(Decision.proceed(snapshot.timestamp()));
        }
        Threshold primary = tripped.stream()
                .filter(t -> t.decision() != DecisionType.ALERT)
                .findFirst()
                .orElse(tripped.get(0));
        List<Decision> decisions = new ArrayList<>(tripped.size());
        decisions.add(new Decision(primary.decision(), primary.kind(), snapshot.timestamp(),
                describe(primary, snapshot)));
        for (Threshold t : tripped) {
            if (t != primary) {
                decisions.add(new Decision(DecisionType.ALERT, t.kind(), snapshot.timestamp(), describe(t, snapshot)));
            }
        }
        return decisions;
    }

    /**
     * Evaluates {@code snapshot} for the current job and produces de-duplicated alerts for every
     * tripped rule.
     *
     * @param snapshot reading to evaluate
     * @param jobState state of the active job, or null when there is none
     * @param jobId active job, or null
     */
    public PolicyEvaluation evaluate(ResourceSnapshot snapshot, JobState jobState, JobId jobId) {
        List<Decision> decisions = new ArrayList<>(assess(snapshot));
        Decision primary = decisions.get(0);
        boolean jobActive = jobState != null && !jobState.isTerminal();
        if (!jobActive && primary.type() != DecisionType.CONTINUE && primary.type() != DecisionType.ALERT) {
            decisions.set(0, new Decision(DecisionType.ALERT, primary.kind(), primary.snapshotTimestamp(),
                    primary.reason()));
        }

        List<Alert> alerts = new ArrayList<>();
        List<Threshold> tripped = tripped(snapshot);
        for (ResourceKind kind : ResourceKind.values()) {
            Threshold t = thresholds.get(kind);
            if (t == null || !tripped.contains(t)) {
                deduplicator.clear(kind.alertKind());
                continue;
            }
            AlertSeverity severity = severityFor(t, snapshot);
            if (deduplicator.shouldEmit(kind.alertKind(), severity, snapshot.timestamp())) {
                alerts.add(Alert.raise(severity, kind.alertKind(), describe(t, snapshot), snapshot.timestamp(),
                        jobActive ? jobId : null, snapshot.timestamp()));
            }
        }
        return new PolicyEvaluation(snapshot, decisions, alerts);
    }

    private List<Threshold> tripped(ResourceSnapshot snapshot) {
        List<Threshold> out = new ArrayList<>();
        for (ResourceKind kind : ResourceKind.values()) {
            Threshold t = thresholds.get(kind);
            if (t != null && t.isTrippedBy(snapshot)) {
                out.add(t);
            }
        }
        return out;
    }

    static AlertSeverity severityFor(Threshold t, ResourceSnapshot s) {
        double value = t.kind().measure(s);
        return switch (t.kind()) {
            case THERMAL_CEILING -> AlertSeverity.CRITICAL;
            case THERMAL_THROTTLE -> AlertSeverity.WARNING;
            case BATTERY -> value < t.limit() / 2 ? AlertSeverity.ERROR : AlertSeverity.WARNING;
            case STORAGE -> AlertSeverity.ERROR;
            case MEMORY -> value < t.limit() / 2 ? AlertSeverity.WARNING : AlertSeverity.INFO;
        };
    }

    static String describe(Threshold t, ResourceSnapshot s) {
        return switch (t.kind()) {
            case THERMAL_CEILING -> "Thermal state " + s.thermalState() + " reached ceiling "
                    + thermalName(t.limit());
            case THERMAL_THROTTLE -> "Thermal state " + s.thermalState() + " reached throttle level "
                    + thermalName(t.limit());
            case BATTERY -> String.format(Locale.ROOT, "Battery at %.0f%% (minimum %.0f%%) and not charging",
                    s.batteryLevel() * 100, t.limit() * 100);
            case STORAGE -> "Available storage " + ByteSizes.format(s.availableStorageBytes())
                    + " below minimum " + ByteSizes.format((long) t.limit());
            case MEMORY -> "Available memory " + ByteSizes.format(s.availableMemoryBytes())
                    + " below minimum " + ByteSizes.format((long) t.limit());
        };
    }

    private static String thermalName(double ordinal) {
        ThermalState[] states = ThermalState.values();
        int i = (int) Math.round(ordinal);
        return i >= 0 && i < states.length ? states[i].name() : String.valueOf(ordinal);
    }
}
