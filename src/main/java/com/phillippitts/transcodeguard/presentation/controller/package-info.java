/**
 * REST endpoints over the conversion coordinator, alert log, resource monitor and policy thresholds.
 *
 * <p>Controllers are thin: they translate between JSON views and domain types and map command
 * outcomes to HTTP statuses. Domain exceptions are rendered by
 * {@code presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.transcodeguard.presentation.controller;
