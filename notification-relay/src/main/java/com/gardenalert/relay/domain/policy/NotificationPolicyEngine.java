package com.gardenalert.relay.domain.policy;

import com.gardenalert.common.model.ItemCategory;
import com.gardenalert.common.model.RarityTier;
import com.gardenalert.relay.domain.detection.DetectedChanges;
import com.gardenalert.relay.domain.detection.EventDelta;
import com.gardenalert.relay.domain.detection.ItemDelta;
import com.gardenalert.relay.domain.detection.WeatherDelta;
import com.gardenalert.relay.domain.rarity.RarityResolver;
import com.gardenalert.relay.domain.registry.DeviceRegistration;
import com.gardenalert.relay.domain.registry.DeviceRegistry;
import com.gardenalert.relay.domain.registry.DeviceTokens;
import com.gardenalert.relay.domain.registry.WeatherMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides, per device, which detected changes become notification intents. Pure apart
 * from logging: no gateway, no dedup, no clock.
 */
@Slf4j
public class NotificationPolicyEngine {

    private final RarityResolver rarityResolver;
    private final RarityTier premiumTier;
    private final Set<String> reportedUnclassified = ConcurrentHashMap.newKeySet();

    public NotificationPolicyEngine(RarityResolver rarityResolver, RarityTier premiumTier) {
        this.rarityResolver = rarityResolver;
        this.premiumTier = premiumTier;
    }

    public List<NotificationIntent> plan(DetectedChanges changes, DeviceRegistry registry) {
        var eligibleItems = eligibleItems(changes.itemDeltas());
        var devices = registry.all().stream()
                .sorted(Comparator.comparing(DeviceRegistration::registeredAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();

        var intents = new ArrayList<NotificationIntent>();
        for (var device : devices) {
            if (!device.notificationsEnabled()) {
                log.debug("Notifications disabled for {}, skipping", DeviceTokens.mask(device.deviceToken()));
                continue;
            }
            intents.addAll(planItems(device, eligibleItems));
            intents.addAll(planWeather(device, changes.weatherDeltas()));
            changes.event().flatMap(event -> planEvent(device, event)).ifPresent(intents::add);
        }
        log.debug("Planned {} intents for {} devices", intents.size(), devices.size());
        return intents;
    }

    /**
     * Resolves rarity once per delta and drops {@link RarityTier#COMMON} items, which
     * restock constantly and never notify.
     */
    private List<IntentItem> eligibleItems(List<ItemDelta> deltas) {
        var eligible = new ArrayList<IntentItem>();
        for (var delta : deltas) {
            var resolved = rarityResolver.resolve(delta.key(), delta.itemId(), delta.upstreamRarity());
            if (resolved.isUnclassified()) {
                reportUnclassified(delta.key(), resolved.tier());
            }
            if (!resolved.tier().isAbove(RarityTier.COMMON)) {
                log.debug("Rarity filter: {} is {}, not notifying", delta.key(), resolved.tier().label());
                continue;
            }
            eligible.add(IntentItem.builder()
                    .key(delta.key())
                    .displayName(delta.displayName())
                    .category(delta.category())
                    .rarity(resolved.tier())
                    .quantity(delta.currentQty())
                    .previousQuantity(delta.previousQty())
                    .build());
        }
        return eligible;
    }

    private List<NotificationIntent> planItems(DeviceRegistration device, List<IntentItem> eligibleItems) {
        var intents = new ArrayList<NotificationIntent>();
        var regularByCategory = new EnumMap<ItemCategory, List<IntentItem>>(ItemCategory.class);

        for (var item : eligibleItems) {
            if (!device.isFavoriteItem(item.key())) {
                continue;
            }
            if (item.rarity() == premiumTier) {
                intents.add(NotificationIntent.builder()
                        .device(device)
                        .kind(IntentKind.PREMIUM_RESTOCK)
                        .category(item.category())
                        .rarity(item.rarity())
                        .items(List.of(item))
                        .build());
            } else if (item.category() != null) {
                regularByCategory.computeIfAbsent(item.category(), k -> new ArrayList<>()).add(item);
            } else {
                log.debug("Item {} has no category, cannot group it", item.key());
            }
        }

        regularByCategory.forEach((category, items) -> intents.add(NotificationIntent.builder()
                .device(device)
                .kind(IntentKind.CATEGORY_RESTOCK)
                .category(category)
                .items(items)
                .build()));
        return intents;
    }

    private List<NotificationIntent> planWeather(DeviceRegistration device, List<WeatherDelta> deltas) {
        if (deltas.isEmpty() || !device.weatherSettings().enabled()) {
            return List.of();
        }
        var favoritesOnly = device.weatherSettings().mode() == WeatherMode.FAVORITES_ONLY;
        var started = new ArrayList<WeatherDelta>();
        var ended = new ArrayList<WeatherDelta>();
        for (var delta : deltas) {
            if (favoritesOnly && !device.isFavoriteWeather(delta.weatherId())) {
                continue;
            }
            (delta.active() ? started : ended).add(delta);
        }

        var intents = new ArrayList<NotificationIntent>(2);
        if (!started.isEmpty()) {
            intents.add(weatherIntent(device, IntentKind.WEATHER_STARTED, started));
        }
        if (!ended.isEmpty()) {
            intents.add(weatherIntent(device, IntentKind.WEATHER_ENDED, ended));
        }
        return intents;
    }

    private NotificationIntent weatherIntent(DeviceRegistration device, IntentKind kind, List<WeatherDelta> deltas) {
        return NotificationIntent.builder()
                .device(device)
                .kind(kind)
                .weather(deltas)
                .build();
    }

    /**
     * Only the device whose lead time equals this check's offset gets an intent, so each
     * device fires once per event occurrence.
     */
    private Optional<NotificationIntent> planEvent(DeviceRegistration device, EventDelta event) {
        var settings = device.eventSettings();
        if (!settings.enabled() || settings.leadMinutes() != event.minutesBefore()) {
            return Optional.empty();
        }
        return Optional.of(NotificationIntent.builder()
                .device(device)
                .kind(IntentKind.EVENT_UPCOMING)
                .event(event)
                .build());
    }

    private void reportUnclassified(String key, RarityTier defaultTier) {
        if (reportedUnclassified.add(key)) {
            log.warn("Unknown item rarity for '{}', defaulting to {}; add it to the classification table",
                    key, defaultTier.label());
        } else {
            log.debug("Unknown item rarity for '{}', defaulting to {}", key, defaultTier.label());
        }
    }
}
