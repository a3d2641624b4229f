package com.phillippitts.transcodeguard.service.telemetry;

import com.phillippitts.transcodeguard.config.properties.TelemetryProperties;
import com.phillippitts.transcodeguard.domain.ThermalState;
import com.phillippitts.transcodeguard.exception.TelemetryException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Telemetry backed by the host: OS memory via the platform MXBean, free space of the configured
 * storage path, and Linux {@code /sys/class} battery and thermal nodes.
 *
 * <p>Hosts without a battery report full charge on mains power; hosts without thermal zones
 * report {@link ThermalState#NOMINAL}.
 */
public class SystemTelemetrySource implements TelemetrySource {

    private static final Logger LOG = LogManager.getLogger(SystemTelemetrySource.class);

    // Zone temperature (Celsius) at which each thermal state begins
    static final int FAIR_CELSIUS = 60;
    static final int SERIOUS_CELSIUS = 70;
    static final int CRITICAL_CELSIUS = 80;
    static final int EMERGENCY_CELSIUS = 90;

    private final Path storagePath;
    private final Path powerSupplyDir;
    private final Path thermalZoneDir;
    private final com.sun.management.OperatingSystemMXBean osBean;

    public SystemTelemetrySource(TelemetryProperties props) {
        Objects.requireNonNull(props, "props");
        this.storagePath = Path.of(props.getStoragePath());
        this.powerSupplyDir = Path.of(props.getPowerSupplyDir());
        this.thermalZoneDir = Path.of(props.getThermalZoneDir());
        this.osBean = ManagementFactory.getPlatformMXBean(com.sun.management.OperatingSystemMXBean.class);
    }

    @Override
    public RawReading poll() {
        try {
            long freeStorage = Files.getFileStore(storagePath).getUsableSpace();
            long freeMemory = osBean.getFreeMemorySize();
            BatteryReading battery = readBattery();
            ThermalState thermal = readThermal();
            return new RawReading(thermal, battery.level(), battery.charging(), freeMemory, freeStorage);
        } catch (IOException | RuntimeException e) {
            throw new TelemetryException("System telemetry read failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getSourceName() {
        return "system";
    }

    private record BatteryReading(double level, boolean charging) {}

    private BatteryReading readBattery() throws IOException {
        if (!Files.isDirectory(powerSupplyDir)) {
            return new BatteryReading(1.0, true);
        }
        Double level = null;
        boolean charging = false;
        boolean mainsOnline = false;
        try (DirectoryStream<Path> supplies = Files.newDirectoryStream(powerSupplyDir)) {
            for (Path supply : supplies) {
                String type = readTrimmed(supply.resolve("type"));
                if ("Battery".equalsIgnoreCase(type)) {
                    String capacity = readTrimmed(supply.resolve("capacity"));
                    if (capacity != null && level == null) {
                        level = Integer.parseInt(capacity) / 100.0;
                    }
                    String status = readTrimmed(supply.resolve("status"));
                    if (status != null) {
                        String s = status.toLowerCase(Locale.ROOT);
                        charging |= s.equals("charging") || s.equals("full");
                    }
                } else if ("Mains".equalsIgnoreCase(type) || "USB".equalsIgnoreCase(type)) {
                    mainsOnline |= "1".equals(readTrimmed(supply.resolve("online")));
                }
            }
        }
        if (level == null) {
            return new BatteryReading(1.0, true);
        }
        return new BatteryReading(level, charging || mainsOnline);
    }

    private ThermalState readThermal() throws IOException {
        if (!Files.isDirectory(thermalZoneDir)) {
            return ThermalState.NOMINAL;
        }
        int maxMilliCelsius = Integer.MIN_VALUE;
        try (DirectoryStream<Path> zones = Files.newDirectoryStream(thermalZoneDir, "thermal_zone*")) {
            for (Path zone : zones) {
                String temp = readTrimmed(zone.resolve("temp"));
                if (temp == null) {
                    continue;
                }
                try {
                    maxMilliCelsius = Math.max(maxMilliCelsius, Integer.parseInt(temp));
                } catch (NumberFormatException e) {
                    LOG.debug("Ignoring unparseable thermal reading in {}: {}", zone, temp);
                }
            }
        }
        if (maxMilliCelsius == Integer.MIN_VALUE) {
            return ThermalState.NOMINAL;
        }
        return classify(maxMilliCelsius / 1000);
    }

    static ThermalState classify(int celsius) {
        if (celsius >= EMERGENCY_CELSIUS) {
            return ThermalState.EMERGENCY;
        }
        if (celsius >= CRITICAL_CELSIUS) {
            return ThermalState.CRITICAL;
        }
        if (celsius >= SERIOUS_CELSIUS) {
            return ThermalState.SERIOUS;
        }
        if (celsius >= FAIR_CELSIUS) {
            return ThermalState.FAIR;
        }
        return ThermalState.NOMINAL;
    }

    private static String readTrimmed(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            return null;
        }
        return Files.readString(file, StandardCharsets.UTF_8).trim();
    }
}
