package com.phillippitts.transcodeguard.service.alert;

import com.phillippitts.transcodeguard.domain.Alert;
import com.phillippitts.transcodeguard.domain.AlertKind;
import com.phillippitts.transcodeguard.domain.AlertSeverity;
import com.phillippitts.transcodeguard.service.events.AlertRaisedEvent;
import com.phillippitts.transcodeguard.service.events.ConversionEventBus;
import com.phillippitts.transcodeguard.service.metrics.ConversionMetrics;
import com.phillippitts.transcodeguard.testutil.MutableClock;
import com.phillippitts.transcodeguard.testutil.SyncExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertLogTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private MeterRegistry registry;
    private final List<AlertRaisedEvent> published = new ArrayList<>();
    private AlertLog log;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        registry = new SimpleMeterRegistry();
        ConversionEventBus bus = new ConversionEventBus(new SyncExecutor(), 16);
        bus.subscribe(AlertRaisedEvent.class, published::add);
        log = new AlertLog(3, bus, new ConversionMetrics(registry), clock);
    }

    private static Alert alert(AlertKind kind) {
        return Alert.raise(AlertSeverity.WARNING, kind, kind + " raised", T0, null, T0);
    }

    @Test
    void shouldPublishAndCountRecordedAlerts() {
        Alert recorded = log.record(alert(AlertKind.LOW_BATTERY));

        assertThat(published).extracting(AlertRaisedEvent::alert).containsExactly(recorded);
        assertThat(registry.find("transcodeguard.alerts.raised").tag("kind", "low_battery").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldKeepOnlyRetainedAlertsNewestFirst() {
        log.record(alert(AlertKind.LOW_BATTERY));
        log.record(alert(AlertKind.LOW_STORAGE));
        log.record(alert(AlertKind.MEMORY_PRESSURE));
        log.record(alert(AlertKind.THERMAL_THROTTLING));

        assertThat(log.recent(10)).extracting(Alert::kind).containsExactly(
                AlertKind.THERMAL_THROTTLING, AlertKind.MEMORY_PRESSURE, AlertKind.LOW_STORAGE);
    }

    @Test
    void shouldAcknowledgeOnce() {
        Alert recorded = log.record(alert(AlertKind.LOW_BATTERY));
        clock.advance(Duration.ofMinutes(1));

        Alert acked = log.acknowledge(recorded.id()).orElseThrow();

        assertThat(acked.acknowledgedAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(log.find(recorded.id())).contains(acked);
        assertThat(log.unacknowledgedCount()).isZero();
        assertThatThrownBy(() -> log.acknowledge(recorded.id())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldReturnEmptyWhenAcknowledgingUnknownAlert() {
        assertThat(log.acknowledge("missing")).isEmpty();
    }

    @Test
    void shouldClearAllAlerts() {
        log.record(alert(AlertKind.LOW_BATTERY));

        log.clear();

        assertThat(log.recent(10)).isEmpty();
    }
}
