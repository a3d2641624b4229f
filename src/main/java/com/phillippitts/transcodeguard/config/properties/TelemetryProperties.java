package com.phillippitts.transcodeguard.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where the system telemetry source reads device state from.
 */
@ConfigurationProperties(prefix = "telemetry")
@Validated
public class TelemetryProperties {

    /** Directory whose file store's free space is reported as available storage. */
    @NotBlank
    private String storagePath = System.getProperty("java.io.tmpdir");

    /** Linux power-supply class directory. */
    @NotBlank
    private String powerSupplyDir = "/sys/class/power_supply";

    /** Linux thermal class directory. */
    @NotBlank
    private String thermalZoneDir = "/sys/class/thermal";

    public String getStoragePath() {
        return storagePath;
    }

    public void setStoragePath(String storagePath) {
        this.storagePath = storagePath;
    }

    public String getPowerSupplyDir() {
        return powerSupplyDir;
    }

    public void setPowerSupplyDir(String powerSupplyDir) {
        this.powerSupplyDir = powerSupplyDir;
    }

    public String getThermalZoneDir() {
        return thermalZoneDir;
    }

    public void setThermalZoneDir(String thermalZoneDir) {
        this.thermalZoneDir = thermalZoneDir;
    }
}
