package com.phillippitts.transcodeguard.service.alert;

import com.phillippitts.transcodeguard.domain.Alert;
import com.phillippitts.transcodeguard.service.events.AlertRaisedEvent;
import com.phillippitts.transcodeguard.service.events.ConversionEventBus;
import com.phillippitts.transcodeguard.service.metrics.ConversionMetrics;
import com.phillippitts.transcodeguard.util.BoundedHistory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only log of raised alerts, capped at a retention size, that also announces each
 * alert on the event bus.
 *
 * <p>The only in-place change allowed is a single acknowledgement per alert.
 */
public class AlertLog {

    private final BoundedHistory<Alert> alerts;
    private final ConversionEventBus bus;
    private final ConversionMetrics metrics;
    private final Clock clock;

    public AlertLog(int retention, ConversionEventBus bus, ConversionMetrics metrics, Clock clock) {
        this.alerts = new BoundedHistory<>(retention);
        this.bus = Objects.requireNonNull(bus, "bus");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Appends and publishes an alert.
     */
    public Alert record(Alert alert) {
        Objects.requireNonNull(alert, "alert");
        alerts.add(alert);
        metrics.recordAlert(alert.kind());
        bus.publish(new AlertRaisedEvent(alert));
        return alert;
    }

    /** Up to {@code limit} alerts, newest first. */
    public List<Alert> recent(int limit) {
        return alerts.newestFirst(limit);
    }

    public Optional<Alert> find(String alertId) {
        return alerts.find(a -> a.id().equals(alertId));
    }

    /**
     * Sets {@code acknowledgedAt} on an alert that has not been acknowledged yet.
     *
     * @return the acknowledged alert, or empty when no such alert is retained
     * @throws IllegalStateException if the alert was already acknowledged
     */
    public Optional<Alert> acknowledge(String alertId) {
        Objects.requireNonNull(alertId, "alertId");
        return alerts.replace(a -> a.id().equals(alertId), a -> a.acknowledge(clock.instant()));
    }

    public long unacknowledgedCount() {
        return alerts.newestFirst(alerts.capacity()).stream().filter(a -> !a.isAcknowledged()).count();
    }

    public void clear() {
        alerts.clear();
    }
}
