package com.phillippitts.transcodeguard.config.properties;

import com.phillippitts.transcodeguard.domain.ThermalState;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Default policy thresholds and alert handling. Thresholds can be replaced at runtime through
 * the coordinator; these values seed the policy engine at startup.
 */
@ConfigurationProperties(prefix = "policy")
@Validated
public class PolicyProperties {

    /** Battery fraction below which a job pauses when not charging. */
    @DecimalMin(value = "0.0", message = "Battery minimum must be >= 0")
    @DecimalMax(value = "1.0", message = "Battery minimum must be <= 1")
    private double batteryMinimum = 0.15;

    /** Free storage below which a running job is aborted. */
    @PositiveOrZero(message = "Storage minimum must be >= 0")
    private long storageMinimumBytes = 512L * 1024 * 1024;

    /** Free memory below which an informational alert is raised. */
    @PositiveOrZero(message = "Memory minimum must be >= 0")
    private long memoryMinimumBytes = 256L * 1024 * 1024;

    /** Thermal state at or above which a job is aborted. */
    @NotNull
    private ThermalState thermalCeiling = ThermalState.CRITICAL;

    /** Thermal state at or above which the engine is throttled. */
    @NotNull
    private ThermalState thermalThrottle = ThermalState.SERIOUS;

    /** Minimum time before an unchanged alert is raised again, in seconds. */
    @PositiveOrZero(message = "Alert cooldown must be >= 0")
    private long alertCooldownSeconds = 60;

    /** Alerts retained in the alert log. */
    @Positive(message = "Alert retention must be positive")
    private int alertRetention = 200;

    public double getBatteryMinimum() {
        return batteryMinimum;
    }

    public void setBatteryMinimum(double batteryMinimum) {
        this.batteryMinimum = batteryMinimum;
    }

    public long getStorageMinimumBytes() {
        return storageMinimumBytes;
    }

    public void setStorageMinimumBytes(long storageMinimumBytes) {
        this.storageMinimumBytes = storageMinimumBytes;
    }

    public long getMemoryMinimumBytes() {
        return memoryMinimumBytes;
    }

    public void setMemoryMinimumBytes(long memoryMinimumBytes) {
        this.memoryMinimumBytes = memoryMinimumBytes;
    }

    public ThermalState getThermalCeiling() {
        return thermalCeiling;
    }

    public void setThermalCeiling(ThermalState thermalCeiling) {
        this.thermalCeiling = thermalCeiling;
    }

    public ThermalState getThermalThrottle() {
        return thermalThrottle;
    }

    public void setThermalThrottle(ThermalState thermalThrottle) {
        this.thermalThrottle = thermalThrottle;
    }

    public long getAlertCooldownSeconds() {
        return alertCooldownSeconds;
    }

    public void setAlertCooldownSeconds(long alertCooldownSeconds) {
        this.alertCooldownSeconds = alertCooldownSeconds;
    }

    public Duration alertCooldown() {
        return Duration.ofSeconds(alertCooldownSeconds);
    }

    public int getAlertRetention() {
        return alertRetention;
    }

    public void setAlertRetention(int alertRetention) {
        this.alertRetention = alertRetention;
    }
}
