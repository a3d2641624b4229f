package com.phillippitts.transcodeguard.service.job;

/**
 * Inputs that drive a job through its lifecycle.
 */
public enum JobEvent {
    START,
    ENGINE_READY,
    VALIDATION_FAILED,
    PRECHECK_TIMEOUT,
    PAUSE,
    RESUME,
    PROGRESS_COMPLETE,
    ENGINE_SUCCESS,
    ENGINE_ERROR,
    ABORT,
    CANCEL_REQUEST,
    ENGINE_STOPPED,
    STOP_TIMEOUT
}
