package com.phillippitts.transcodeguard.service.coordinator;

/**
 * Result of a job command such as cancel, pause or resume.
 */
public enum CommandOutcome {
    /** The command was applied or is already in effect. */
    ACCEPTED,
    /** The job is not the active job. */
    NOT_FOUND,
    /** The job is active but the command does not apply in its current state. */
    REJECTED
}
