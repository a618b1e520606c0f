package com.gardenalert.relay.domain.detection;

import com.gardenalert.relay.domain.catalog.CatalogSnapshot;
import com.gardenalert.relay.domain.catalog.EventState;
import com.gardenalert.relay.domain.catalog.WeatherSnapshot;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns two snapshots (and the wall clock, for events) into per-entity deltas. Stateless.
 */
@Slf4j
public class ChangeDetector {

    /** Lead offsets checked before an event trigger, in minutes. 0 is the trigger itself. */
    public static final List<Integer> EVENT_LEAD_MINUTES = List.of(0, 1, 2, 5, 10, 15);

    private final int eventToleranceSeconds;

    public ChangeDetector(int eventToleranceSeconds) {
        if (eventToleranceSeconds < 1 || eventToleranceSeconds > 60) {
            throw new IllegalArgumentException("Event tolerance must be 1-60 seconds: " + eventToleranceSeconds);
        }
        this.eventToleranceSeconds = eventToleranceSeconds;
    }

    /**
     * Emits a delta for every tracked key that is in stock in {@code current}. The
     * previous quantity is reported but never gates emission: an item can sell out and
     * restock to the same quantity between two polls.
     */
    public List<ItemDelta> detectItemChanges(
            CatalogSnapshot previous, CatalogSnapshot current, Collection<String> trackedKeys, DetectionMode mode) {
        var deltas = new ArrayList<ItemDelta>();
        for (var key : new TreeSet<>(trackedKeys)) {
            var item = current.get(key);
            var previousQty = previous.quantityOf(key);
            if (item.isEmpty() || !item.get().inStock()) {
                if (previousQty > 0) {
                    log.debug("{} {} went out of stock ({} -> 0)", mode, key, previousQty);
                }
                continue;
            }
            var currentItem = item.get();
            deltas.add(ItemDelta.builder()
                    .key(key)
                    .displayName(currentItem.displayName())
                    .itemId(currentItem.itemId())
                    .upstreamRarity(currentItem.upstreamRarity())
                    .category(currentItem.category())
                    .previousQty(previousQty)
                    .currentQty(currentItem.quantity())
                    .build());
            log.debug("{} {} in stock ({} -> {})", mode, key, previousQty, currentItem.quantity());
        }
        return deltas;
    }

    /**
     * Flags ids whose active flag flipped, plus ids active in {@code previous} that vanished
     * from {@code current}. An id unknown to {@code previous} counts as previously inactive.
     * Started transitions are emitted before ended ones.
     */
    public List<WeatherDelta> detectWeatherChanges(WeatherSnapshot previous, WeatherSnapshot current) {
        var started = new ArrayList<WeatherDelta>();
        var ended = new ArrayList<WeatherDelta>();

        for (var condition : current.conditions()) {
            var wasActive = previous.get(condition.weatherId()).map(w -> w.active()).orElse(false);
            if (wasActive == condition.active()) {
                continue;
            }
            var delta = WeatherDelta.builder()
                    .weatherId(condition.weatherId())
                    .name(condition.name())
                    .active(condition.active())
                    .wasActive(wasActive)
                    .durationSeconds(condition.durationSeconds())
                    .build();
            (condition.active() ? started : ended).add(delta);
        }

        for (var condition : previous.conditions()) {
            if (condition.active() && !current.contains(condition.weatherId())) {
                ended.add(WeatherDelta.builder()
                        .weatherId(condition.weatherId())
                        .name(condition.name())
                        .active(false)
                        .wasActive(true)
                        .durationSeconds(0)
                        .build());
            }
        }

        var deltas = new ArrayList<WeatherDelta>(started.size() + ended.size());
        deltas.addAll(started);
        deltas.addAll(ended);
        return deltas;
    }

    /**
     * Fires when the UTC minute-of-hour equals the trigger minute or one of the lead
     * offsets before it, and only inside the first {@code eventToleranceSeconds} of that
     * minute. Two ticks inside one window yield the same delta; deduplication drops the second.
     */
    public Optional<EventDelta> detectEvent(EventState event, Instant now) {
        if (event == null) {
            return Optional.empty();
        }
        var time = now.atOffset(ZoneOffset.UTC);
        if (time.getSecond() >= eventToleranceSeconds) {
            return Optional.empty();
        }
        var minute = time.getMinute();
        for (var lead : EVENT_LEAD_MINUTES) {
            var checkMinute = Math.floorMod(event.correctedTriggerMinute() - lead, 60);
            if (checkMinute == minute) {
                return Optional.of(new EventDelta(event.name(), event.correctedTriggerMinute(), lead));
            }
        }
        return Optional.empty();
    }
}
