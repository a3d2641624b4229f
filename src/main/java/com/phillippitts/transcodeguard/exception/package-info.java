/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.transcodeguard.exception.TranscodeGuardException} - Base exception</li>
 *   <li>{@link com.phillippitts.transcodeguard.exception.ValidationException} - precheck failure
 *       at submit time (bad input, unwritable output, insufficient space)</li>
 *   <li>{@link com.phillippitts.transcodeguard.exception.AlreadyRunningException} - submit while a
 *       job is active</li>
 *   <li>{@link com.phillippitts.transcodeguard.exception.EngineException} - codec engine failure,
 *       terminal for the job</li>
 *   <li>{@link com.phillippitts.transcodeguard.exception.TelemetryException} - transient telemetry
 *       read failure</li>
 *   <li>{@link com.phillippitts.transcodeguard.exception.OperationTimeoutException} - bounded
 *       operation exceeded its deadline</li>
 *   <li>{@link com.phillippitts.transcodeguard.exception.IllegalTransitionException} - undefined job
 *       transition, including leaving a terminal state</li>
 *   <li>{@link com.phillippitts.transcodeguard.exception.JobNotFoundException} - unknown job id at
 *       the REST boundary</li>
 * </ul>
 *
 * @see com.phillippitts.transcodeguard.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.transcodeguard.exception;
