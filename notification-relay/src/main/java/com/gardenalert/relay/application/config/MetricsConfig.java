package com.gardenalert.relay.application.config;

import com.gardenalert.relay.domain.catalog.SnapshotStore;
import com.gardenalert.relay.domain.dedup.DeduplicationCache;
import com.gardenalert.relay.domain.registry.DeviceRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter cyclesCompletedCounter(MeterRegistry registry) {
        return Counter.builder("relay.cycles.completed")
                .description("Poll cycles run to completion")
                .register(registry);
    }

    @Bean
    public Counter notificationsSentCounter(MeterRegistry registry) {
        return Counter.builder("relay.notifications.sent")
                .description("Notifications accepted by the push gateway")
                .register(registry);
    }

    @Bean
    public Counter notificationsFailedCounter(MeterRegistry registry) {
        return Counter.builder("relay.notifications.failed")
                .description("Notifications the push gateway rejected or could not deliver")
                .register(registry);
    }

    @Bean
    public Counter notificationsSuppressedCounter(MeterRegistry registry) {
        return Counter.builder("relay.notifications.suppressed")
                .description("Notifications blocked by the dedup window")
                .register(registry);
    }

    @Bean
    public Counter notificationsAbortedCounter(MeterRegistry registry) {
        return Counter.builder("relay.notifications.aborted")
                .description("Intents dropped because their payload could not be composed")
                .register(registry);
    }

    @Bean
    public Gauge registeredDevicesGauge(MeterRegistry registry, DeviceRegistry deviceRegistry) {
        return Gauge.builder("relay.devices.registered", deviceRegistry::size)
                .description("Devices currently registered")
                .register(registry);
    }

    @Bean
    public Gauge catalogItemsGauge(MeterRegistry registry, SnapshotStore snapshotStore) {
        return Gauge.builder("relay.catalog.items", () -> snapshotStore.current().currentCatalog().size())
                .description("Items in the current catalog snapshot")
                .register(registry);
    }

    @Bean
    public Gauge dedupEntriesGauge(MeterRegistry registry, DeduplicationCache deduplicationCache) {
        return Gauge.builder("relay.dedup.entries", deduplicationCache::size)
                .description("Signatures held in the dedup cache")
                .register(registry);
    }
}
