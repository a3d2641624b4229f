package com.phillippitts.transcodeguard.service.policy;

/**
 * Action the policy engine asks the coordinator to take for the active job.
 */
public enum DecisionType {
    /** Nothing tripped; a policy-paused job may resume and throttling is lifted. */
    CONTINUE,
    /** Keep running with the engine throttled. */
    THROTTLE,
    /** Suspend the job until the condition clears. */
    PAUSE,
    /** Stop the job; it ends CANCELLED. */
    ABORT,
    /** Informational only; the job is not affected. */
    ALERT
}
