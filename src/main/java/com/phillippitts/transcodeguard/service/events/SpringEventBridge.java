package com.phillippitts.transcodeguard.service.events;

import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;

/**
 * Re-publishes every bus event as a Spring application event so {@code @EventListener}
 * components can observe the subsystem. Runs on the bus delivery executor, never on the
 * coordinator's thread.
 */
public final class SpringEventBridge implements AutoCloseable {

    private final ConversionEventBus.Subscription subscription;

    public SpringEventBridge(ConversionEventBus bus, ApplicationEventPublisher publisher) {
        Objects.requireNonNull(publisher, "publisher");
        this.subscription = bus.subscribe(e -> true, publisher::publishEvent);
    }

    @Override
    public void close() {
        subscription.close();
    }
}
