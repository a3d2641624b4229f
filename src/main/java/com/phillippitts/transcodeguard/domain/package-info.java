/**
 * Domain model for conversion jobs and device resources.
 *
 * <p>Types here are immutable value objects apart from {@link
 * com.phillippitts.transcodeguard.domain.MonitoringSession}, whose sample counter is updated by
 * the polling thread. Mutation of job state is owned by the conversion coordinator, which
 * replaces {@link com.phillippitts.transcodeguard.domain.ConversionJob} instances rather than
 * changing them.
 */
package com.phillippitts.transcodeguard.domain;
