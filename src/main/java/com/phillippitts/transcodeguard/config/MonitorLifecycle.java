package com.phillippitts.transcodeguard.config;

import com.phillippitts.transcodeguard.config.properties.MonitorProperties;
import com.phillippitts.transcodeguard.service.monitor.ResourceMonitor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts resource monitoring once the application is ready, when {@code monitor.auto-start}
 * is set. Otherwise the first submission starts it. Shutdown is handled by the monitor bean's
 * {@code close()}.
 */
@Component
class MonitorLifecycle {

    private static final Logger LOG = LogManager.getLogger(MonitorLifecycle.class);

    private final ResourceMonitor monitor;
    private final MonitorProperties properties;

    MonitorLifecycle(ResourceMonitor monitor, MonitorProperties properties) {
        this.monitor = monitor;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    void onReady() {
        if (!properties.isAutoStart()) {
            LOG.info("monitor.auto-start=false; monitoring starts with the first submission");
            return;
        }
        monitor.start(properties.pollInterval());
    }
}
