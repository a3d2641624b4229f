package com.phillippitts.transcodeguard.service.policy;

import java.time.Instant;
import java.util.Objects;

/**
 * One policy outcome, tied to the snapshot it was computed from.
 *
 * @param type action
 * @param kind rule that produced it, null for CONTINUE
 * @param snapshotTimestamp timestamp of the source snapshot; used to discard stale decisions
 * @param reason human-readable explanation
 */
public record Decision(DecisionType type, ResourceKind kind, Instant snapshotTimestamp, String reason) {

    public Decision {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(snapshotTimestamp, "snapshotTimestamp");
        if (reason == null) {
            reason = "";
        }
    }

    public static Decision proceed(Instant snapshotTimestamp) {
        return new Decision(DecisionType.CONTINUE, null, snapshotTimestamp, "all resources within limits");
    }

    public boolean isOlderThan(Instant other) {
        return other != null && snapshotTimestamp.isBefore(other);
    }
}
