package com.gardenalert.relay.domain.relay;

import com.gardenalert.relay.domain.catalog.CatalogFetcher;
import com.gardenalert.relay.domain.catalog.CatalogSnapshot;
import com.gardenalert.relay.domain.catalog.EventFetcher;
import com.gardenalert.relay.domain.catalog.SnapshotGeneration;
import com.gardenalert.relay.domain.catalog.SnapshotStore;
import com.gardenalert.relay.domain.catalog.WeatherFetcher;
import com.gardenalert.relay.domain.catalog.WeatherSnapshot;
import com.gardenalert.relay.domain.dedup.DeduplicationCache;
import com.gardenalert.relay.domain.detection.ChangeDetector;
import com.gardenalert.relay.domain.detection.DetectedChanges;
import com.gardenalert.relay.domain.detection.DetectionMode;
import com.gardenalert.relay.domain.detection.ItemDelta;
import com.gardenalert.relay.domain.detection.WeatherDelta;
import com.gardenalert.relay.domain.dispatch.DispatchSummary;
import com.gardenalert.relay.domain.dispatch.NotificationDispatcher;
import com.gardenalert.relay.domain.policy.NotificationPolicyEngine;
import com.gardenalert.relay.domain.registry.DeviceRegistry;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs poll cycles: fetch, swap, detect, plan, gate, dispatch. Every entry point takes
 * the cycle lock, so at most one cycle (scheduled or admin-triggered) is ever in flight.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationRelayEngine {

    private final ReentrantLock cycleLock = new ReentrantLock();

    private final CatalogFetcher catalogFetcher;
    private final WeatherFetcher weatherFetcher;
    private final EventFetcher eventFetcher;
    private final SnapshotStore snapshotStore;
    private final ChangeDetector changeDetector;
    private final NotificationPolicyEngine policyEngine;
    private final NotificationDispatcher dispatcher;
    private final DeduplicationCache deduplicationCache;
    private final DeviceRegistry deviceRegistry;
    private final Executor fetchExecutor;
    private final Clock clock;
    private final Counter cyclesCompletedCounter;

    private volatile CycleStage stage = CycleStage.IDLE;
    private volatile CycleReport lastReport;

    public CycleReport runCycle() {
        cycleLock.lock();
        try {
            var startedAt = clock.instant();

            var catalogFuture = CompletableFuture.supplyAsync(catalogFetcher::fetchCatalog, fetchExecutor)
                    .exceptionally(e -> {
                        log.warn("Catalog fetch failed, keeping last-known-good snapshot: {}", rootMessage(e));
                        return null;
                    });
            var weatherFuture = CompletableFuture.supplyAsync(weatherFetcher::fetchWeather, fetchExecutor)
                    .exceptionally(e -> {
                        log.warn("Weather fetch failed, treating as no weather this cycle: {}", rootMessage(e));
                        return WeatherSnapshot.empty();
                    });
            CompletableFuture.allOf(catalogFuture, weatherFuture).join();

            CatalogSnapshot catalog = catalogFuture.join();
            var weather = weatherFuture.join();
            var generation = catalog != null
                    ? snapshotStore.swap(catalog, weather)
                    : snapshotStore.swapKeepingCatalog(weather);
            stage = CycleStage.SNAPSHOT_SWAPPED;

            var changes = detect(generation, DetectionMode.RESTOCK, startedAt);
            var report = planAndDispatch(changes, generation, DetectionMode.RESTOCK, startedAt);
            cyclesCompletedCounter.increment();
            return report;
        } finally {
            stage = CycleStage.IDLE;
            cycleLock.unlock();
        }
    }

    /**
     * Re-announces every tracked item currently in stock, without fetching or swapping.
     * Weather and events are not considered.
     */
    public CycleReport checkAvailability() {
        cycleLock.lock();
        try {
            var startedAt = clock.instant();
            var generation = snapshotStore.current();
            var itemDeltas = changeDetector.detectItemChanges(
                    generation.previousCatalog(),
                    generation.currentCatalog(),
                    deviceRegistry.trackedItemKeys(),
                    DetectionMode.AVAILABILITY);
            stage = CycleStage.DIFFED;
            return planAndDispatch(DetectedChanges.itemsOnly(itemDeltas), generation, DetectionMode.AVAILABILITY, startedAt);
        } finally {
            stage = CycleStage.IDLE;
            cycleLock.unlock();
        }
    }

    public void refreshEvent() {
        cycleLock.lock();
        try {
            var event = eventFetcher.fetchEvent();
            snapshotStore.updateEvent(event.orElse(null));
        } catch (RuntimeException e) {
            log.warn("Event refresh failed, keeping previous event: {}", e.getMessage());
        } finally {
            cycleLock.unlock();
        }
    }

    public int clearNotificationCache() {
        cycleLock.lock();
        try {
            var cleared = deduplicationCache.size();
            deduplicationCache.clear();
            log.info("Cleared notification cache ({} entries)", cleared);
            return cleared;
        } finally {
            cycleLock.unlock();
        }
    }

    public CycleStage stage() {
        return stage;
    }

    public CycleReport lastReport() {
        return lastReport;
    }

    private DetectedChanges detect(SnapshotGeneration generation, DetectionMode mode, Instant now) {
        List<ItemDelta> itemDeltas = generation.catalogFresh()
                ? changeDetector.detectItemChanges(
                        generation.previousCatalog(), generation.currentCatalog(), deviceRegistry.trackedItemKeys(), mode)
                : List.of();
        List<WeatherDelta> weatherDeltas =
                changeDetector.detectWeatherChanges(generation.previousWeather(), generation.currentWeather());
        var event = snapshotStore.currentEvent()
                .flatMap(state -> changeDetector.detectEvent(state, now))
                .orElse(null);
        stage = CycleStage.DIFFED;
        return new DetectedChanges(itemDeltas, weatherDeltas, event);
    }

    private CycleReport planAndDispatch(
            DetectedChanges changes, SnapshotGeneration generation, DetectionMode mode, Instant startedAt) {
        var summary = DispatchSummary.empty();
        var intentCount = 0;
        if (!changes.isEmpty()) {
            var intents = policyEngine.plan(changes, deviceRegistry);
            intentCount = intents.size();
            stage = CycleStage.PLANNED;

            var gated = dispatcher.gate(intents);
            stage = CycleStage.DEDUPED;

            summary = dispatcher.deliver(gated);
            stage = CycleStage.DISPATCHED;
        }

        var report = CycleReport.builder()
                .mode(mode)
                .startedAt(startedAt)
                .catalogFresh(generation.catalogFresh())
                .catalogItems(generation.currentCatalog().size())
                .weatherConditions(generation.currentWeather().size())
                .itemDeltas(changes.itemDeltas().size())
                .weatherDeltas(changes.weatherDeltas().size())
                .eventFired(changes.event().isPresent())
                .intents(intentCount)
                .dispatch(summary)
                .build();
        lastReport = report;
        log.info("{} cycle complete: {} items, {} weather, {} item deltas, {} weather deltas, {} intents, {} sent",
                mode, report.catalogItems(), report.weatherConditions(), report.itemDeltas(),
                report.weatherDeltas(), intentCount, summary.sent());
        return report;
    }

    private static String rootMessage(Throwable e) {
        var cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage();
    }
}
