package com.phillippitts.transcodeguard.service.events;

import com.phillippitts.transcodeguard.domain.Alert;
import com.phillippitts.transcodeguard.domain.AlertSeverity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs raised alerts, throttled per alert kind to avoid log spam.
 */
@Component
class AlertEventsListener {
    private static final Logger LOG = LogManager.getLogger(AlertEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onAlert(AlertRaisedEvent e) {
        Alert alert = e.alert();
        String key = alert.kind() + "-" + alert.severity();
        if (!shouldLog(key)) {
            return;
        }
        if (alert.severity().compareTo(AlertSeverity.ERROR) >= 0) {
            LOG.error("Alert {} [{}]: {} (job={})", alert.kind(), alert.severity(), alert.message(), alert.jobId());
        } else if (alert.severity() == AlertSeverity.WARNING || alert.kind().isDegradation()) {
            LOG.warn("Alert {} [{}]: {} (job={})", alert.kind(), alert.severity(), alert.message(), alert.jobId());
        } else {
            LOG.info("Alert {} [{}]: {} (job={})", alert.kind(), alert.severity(), alert.message(), alert.jobId());
        }
    }

    @EventListener
    void onJobStateChanged(JobStateChangedEvent e) {
        if (e.to().isTerminal()) {
            LOG.info("Job {} finished: {} -> {}{}", e.jobId(), e.from(), e.to(),
                    e.job().failureReason() == null ? "" : " (" + e.job().failureReason() + ")");
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
