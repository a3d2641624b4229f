package com.phillippitts.transcodeguard.domain;

/**
 * Lifecycle states of a {@link ConversionJob}.
 *
 * <p>{@code PENDING} through {@code CANCELLING} are non-terminal; at most one job may occupy
 * one of them at a time. Terminal states never change again.
 */
public enum JobState {
    PENDING,
    PREPARING,
    RUNNING,
    PAUSED,
    CANCELLING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
