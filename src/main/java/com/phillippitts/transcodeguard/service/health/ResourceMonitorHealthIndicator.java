package com.phillippitts.transcodeguard.service.health;

import com.phillippitts.transcodeguard.config.properties.PolicyProperties;
import com.phillippitts.transcodeguard.domain.ResourceSnapshot;
import com.phillippitts.transcodeguard.service.monitor.ResourceMonitor;
import com.phillippitts.transcodeguard.util.ByteSizes;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for device resource monitoring.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: Monitoring running, telemetry fresh, thermal below the throttle level</li>
 *   <li>DEGRADED: Consecutive telemetry failures, or thermal at/above the throttle level</li>
 *   <li>DOWN: Monitoring stopped, or thermal at/above the ceiling</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ResourceMonitorHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final ResourceMonitor monitor;
    private final PolicyProperties policyProperties;

    public ResourceMonitorHealthIndicator(ResourceMonitor monitor, PolicyProperties policyProperties) {
        this.monitor = monitor;
        this.policyProperties = policyProperties;
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        ResourceSnapshot latest = monitor.latest().orElse(null);

        if (!monitor.isRunning()) {
            builder.down().withDetail("status", "Resource monitoring stopped");
        } else if (latest != null && latest.thermalState().isAtLeast(policyProperties.getThermalCeiling())) {
            builder.down().withDetail("status", "Thermal state at or above ceiling");
        } else if (monitor.isDegraded()) {
            builder.status(DEGRADED).withDetail("status", "Telemetry reads failing");
        } else if (latest != null && latest.thermalState().isAtLeast(policyProperties.getThermalThrottle())) {
            builder.status(DEGRADED).withDetail("status", "Thermal throttling");
        } else {
            builder.up().withDetail("status", "Monitoring operational");
        }

        builder.withDetail("consecutiveFailures", monitor.getConsecutiveFailures());
        monitor.currentSession().ifPresent(s -> builder
                .withDetail("session", s.getId())
                .withDetail("samples", s.getSamplesTaken()));
        if (latest != null) {
            builder.withDetail("thermal", latest.thermalState().name())
                    .withDetail("battery", Math.round(latest.batteryLevel() * 100) + "%")
                    .withDetail("charging", latest.charging())
                    .withDetail("memoryAvailable", ByteSizes.format(latest.availableMemoryBytes()))
                    .withDetail("storageAvailable", ByteSizes.format(latest.availableStorageBytes()))
                    .withDetail("sampledAt", latest.timestamp().toString());
        }
        return builder.build();
    }
}
