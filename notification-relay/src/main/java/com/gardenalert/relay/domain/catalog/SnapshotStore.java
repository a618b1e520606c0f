package com.gardenalert.relay.domain.catalog;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Holds the current and previous catalog/weather snapshots plus the current event.
 * Each swap publishes a whole new {@link SnapshotGeneration}, so readers never see a
 * catalog from one cycle paired with weather from another.
 */
@Slf4j
@Component
public class SnapshotStore {

    private final AtomicReference<SnapshotGeneration> generation =
            new AtomicReference<>(SnapshotGeneration.initial());
    private final AtomicReference<EventState> event = new AtomicReference<>();

    public SnapshotGeneration swap(CatalogSnapshot catalog, WeatherSnapshot weather) {
        return generation.updateAndGet(prior -> new SnapshotGeneration(
                prior.currentCatalog(),
                catalog,
                prior.currentWeather(),
                weather,
                true,
                catalog.fetchedAt(),
                weatherUpdatedAt(prior, weather)));
    }

    /**
     * Advances weather only; the last-known-good catalog stays current and becomes its
     * own predecessor.
     */
    public SnapshotGeneration swapKeepingCatalog(WeatherSnapshot weather) {
        var next = generation.updateAndGet(prior -> new SnapshotGeneration(
                prior.currentCatalog(),
                prior.currentCatalog(),
                prior.currentWeather(),
                weather,
                false,
                prior.catalogUpdatedAt(),
                weatherUpdatedAt(prior, weather)));
        log.info("Catalog unavailable this cycle, keeping {} last-known-good items", next.currentCatalog().size());
        return next;
    }

    public SnapshotGeneration current() {
        return generation.get();
    }

    public Optional<EventState> currentEvent() {
        return Optional.ofNullable(event.get());
    }

    public void updateEvent(EventState state) {
        var prior = event.getAndSet(state);
        if (state != null && !state.equals(prior)) {
            log.info("Event updated: {} (trigger minute {})", state.name(), state.correctedTriggerMinute());
        } else if (state == null && prior != null) {
            log.info("Event {} no longer active", prior.name());
        }
    }

    private static Instant weatherUpdatedAt(SnapshotGeneration prior, WeatherSnapshot weather) {
        return weather.fetchedAt() != null ? weather.fetchedAt() : prior.weatherUpdatedAt();
    }
}
