package com.gardenalert.relay.application.service;

import com.gardenalert.relay.domain.catalog.CatalogItem;
import com.gardenalert.relay.domain.catalog.DataFreshness;
import com.gardenalert.relay.domain.catalog.EventState;
import com.gardenalert.relay.domain.catalog.SnapshotStore;
import com.gardenalert.relay.domain.catalog.WeatherCondition;
import com.gardenalert.relay.domain.dedup.DeduplicationCache;
import com.gardenalert.relay.domain.rarity.RarityResolver;
import com.gardenalert.relay.domain.rarity.ResolvedRarity;
import com.gardenalert.relay.domain.registry.DeviceRegistry;
import com.gardenalert.relay.domain.relay.NotificationRelayEngine;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Read side for the HTTP surface. Everything comes from the current snapshot generation,
 * so one response never mixes two cycles.
 */
@Component
@RequiredArgsConstructor
public class RelayQueryHandler {

    private final SnapshotStore snapshotStore;
    private final RarityResolver rarityResolver;
    private final DeviceRegistry deviceRegistry;
    private final DeduplicationCache deduplicationCache;
    private final NotificationRelayEngine engine;
    private final Clock clock;

    public Map<CatalogItem, ResolvedRarity> catalog() {
        var result = new LinkedHashMap<CatalogItem, ResolvedRarity>();
        for (var item : snapshotStore.current().currentCatalog().items()) {
            result.put(item, rarityResolver.resolve(item.key(), item.itemId(), item.upstreamRarity()));
        }
        return result;
    }

    public Collection<WeatherCondition> weather() {
        return snapshotStore.current().currentWeather().conditions();
    }

    public RelayStatus status() {
        var generation = snapshotStore.current();
        var now = clock.instant();
        var event = snapshotStore.currentEvent();
        return RelayStatus.builder()
                .registeredDevices(deviceRegistry.size())
                .catalogItems(generation.currentCatalog().size())
                .weatherConditions(generation.currentWeather().size())
                .catalogUpdatedAt(generation.catalogUpdatedAt())
                .weatherUpdatedAt(generation.weatherUpdatedAt())
                .freshness(DataFreshness.rate(generation.catalogUpdatedAt(), now))
                .eventName(event.map(EventState::name).orElse(null))
                .eventTriggerMinute(event.map(EventState::correctedTriggerMinute).orElse(null))
                .dedupEntries(deduplicationCache.size())
                .cycleStage(engine.stage())
                .lastCycle(engine.lastReport())
                .checkedAt(now)
                .build();
    }
}
