package com.phillippitts.transcodeguard.config;

import com.phillippitts.transcodeguard.config.properties.ConversionProperties;
import com.phillippitts.transcodeguard.config.properties.FfmpegProperties;
import com.phillippitts.transcodeguard.config.properties.MonitorProperties;
import com.phillippitts.transcodeguard.config.properties.PolicyProperties;
import com.phillippitts.transcodeguard.config.properties.TelemetryProperties;
import com.phillippitts.transcodeguard.service.alert.AlertLog;
import com.phillippitts.transcodeguard.service.coordinator.ConversionCoordinatorBuilder;
import com.phillippitts.transcodeguard.service.coordinator.DefaultConversionCoordinator;
import com.phillippitts.transcodeguard.service.engine.CodecEngine;
import com.phillippitts.transcodeguard.service.engine.ffmpeg.FfmpegCodecEngine;
import com.phillippitts.transcodeguard.service.events.ConversionEventBus;
import com.phillippitts.transcodeguard.service.events.SpringEventBridge;
import com.phillippitts.transcodeguard.service.metrics.ConversionMetrics;
import com.phillippitts.transcodeguard.service.monitor.ResourceMonitor;
import com.phillippitts.transcodeguard.service.policy.PolicyEngine;
import com.phillippitts.transcodeguard.service.policy.Threshold;
import com.phillippitts.transcodeguard.service.storage.FileStore;
import com.phillippitts.transcodeguard.service.storage.LocalFileStore;
import com.phillippitts.transcodeguard.service.telemetry.SystemTelemetrySource;
import com.phillippitts.transcodeguard.service.telemetry.TelemetrySource;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the conversion core explicitly. The core classes are plain Java; every setting reaches
 * them through the typed properties injected here.
 *
 * <p>The collaborator adapters ({@link TelemetrySource}, {@link FileStore}, {@link CodecEngine})
 * back off when another bean of the same type is defined.
 */
@Configuration
public class CoordinatorConfig {

    private final MonitorProperties monitorProperties;
    private final PolicyProperties policyProperties;
    private final ConversionProperties conversionProperties;

    public CoordinatorConfig(MonitorProperties monitorProperties,
                             PolicyProperties policyProperties,
                             ConversionProperties conversionProperties) {
        this.monitorProperties = monitorProperties;
        this.policyProperties = policyProperties;
        this.conversionProperties = conversionProperties;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ConversionMetrics conversionMetrics(MeterRegistry registry) {
        return new ConversionMetrics(registry);
    }

    @Bean
    public ConversionEventBus conversionEventBus(@Qualifier("eventExecutor") Executor eventExecutor) {
        return new ConversionEventBus(eventExecutor, conversionProperties.getSubscriberQueueCapacity());
    }

    @Bean
    public SpringEventBridge springEventBridge(ConversionEventBus bus, ApplicationEventPublisher publisher) {
        return new SpringEventBridge(bus, publisher);
    }

    @Bean
    public AlertLog alertLog(ConversionEventBus bus, ConversionMetrics metrics, Clock clock) {
        return new AlertLog(policyProperties.getAlertRetention(), bus, metrics, clock);
    }

    /**
     * Policy engine seeded with one rule per resource kind from {@code policy.*}.
     */
    @Bean
    public PolicyEngine policyEngine() {
        List<Threshold> defaults = List.of(
                Threshold.thermalCeiling(policyProperties.getThermalCeiling()),
                Threshold.thermalThrottle(policyProperties.getThermalThrottle()),
                Threshold.batteryMinimum(policyProperties.getBatteryMinimum()),
                Threshold.storageMinimum(policyProperties.getStorageMinimumBytes()),
                Threshold.memoryMinimum(policyProperties.getMemoryMinimumBytes()));
        return new PolicyEngine(defaults, policyProperties.alertCooldown());
    }

    @Bean
    @ConditionalOnMissingBean
    public TelemetrySource telemetrySource(TelemetryProperties telemetryProperties) {
        return new SystemTelemetrySource(telemetryProperties);
    }

    @Bean
    public ResourceMonitor resourceMonitor(TelemetrySource telemetrySource, AlertLog alertLog,
                                           ConversionMetrics metrics, Clock clock) {
        return new ResourceMonitor(telemetrySource, alertLog, metrics, clock,
                monitorProperties.getHistorySize(),
                monitorProperties.snapshotTimeout(),
                monitorProperties.getDegradedAfterFailures());
    }

    @Bean
    @ConditionalOnMissingBean
    public FileStore fileStore() {
        return new LocalFileStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public CodecEngine codecEngine(FfmpegProperties ffmpegProperties) {
        return new FfmpegCodecEngine(ffmpegProperties);
    }

    /**
     * The coordinator, registered as the monitor's snapshot listener so every poll tick is
     * evaluated against the active job.
     */
    @Bean
    public DefaultConversionCoordinator conversionCoordinator(CodecEngine codecEngine,
                                                              FileStore fileStore,
                                                              ResourceMonitor resourceMonitor,
                                                              PolicyEngine policyEngine,
                                                              AlertLog alertLog,
                                                              ConversionEventBus bus,
                                                              ConversionMetrics metrics,
                                                              @Qualifier("precheckExecutor") Executor precheckExecutor,
                                                              Clock clock) {
        DefaultConversionCoordinator coordinator = ConversionCoordinatorBuilder.builder()
                .codecEngine(codecEngine)
                .fileStore(fileStore)
                .resourceMonitor(resourceMonitor)
                .policyEngine(policyEngine)
                .alertLog(alertLog)
                .eventBus(bus)
                .metrics(metrics)
                .precheckExecutor(precheckExecutor)
                .properties(conversionProperties)
                .pollInterval(monitorProperties.pollInterval())
                .clock(clock)
                .build();
        resourceMonitor.addListener(coordinator);
        return coordinator;
    }
}
