package com.gardenalert.relay.domain.dispatch;

import com.gardenalert.common.id.UlidGenerator;
import com.gardenalert.common.model.ItemCategory;
import com.gardenalert.relay.domain.detection.EventDelta;
import com.gardenalert.relay.domain.detection.WeatherDelta;
import com.gardenalert.relay.domain.exceptions.NotificationCompositionException;
import com.gardenalert.relay.domain.policy.IntentItem;
import com.gardenalert.relay.domain.policy.IntentKind;
import com.gardenalert.relay.domain.policy.NotificationIntent;
import com.gardenalert.relay.domain.registry.DeviceRegistration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Turns an approved intent into a {@link NotificationPayload}. No eligibility or
 * suppression decisions are made here.
 */
@Component
public class DispatchComposer {

    static final int MAX_LISTED_ITEMS = 6;
    static final String DEFAULT_SOUND = "default";
    private static final String ITEM_SEPARATOR = " • ";
    private static final String WEATHER_EMOJI = "🌦️";
    private static final String EVENT_EMOJI = "⏰";

    public NotificationPayload compose(NotificationIntent intent) {
        return switch (intent.kind()) {
            case CATEGORY_RESTOCK -> categoryRestock(intent);
            case PREMIUM_RESTOCK -> premiumRestock(intent);
            case WEATHER_STARTED, WEATHER_ENDED -> weather(intent);
            case EVENT_UPCOMING -> event(intent);
        };
    }

    private NotificationPayload categoryRestock(NotificationIntent intent) {
        var category = intent.category();
        if (intent.items().isEmpty() || category == null) {
            throw NotificationCompositionException.missingContent(intent.kind());
        }
        var verb = intent.items().size() == 1 ? "is" : "are";
        var data = new LinkedHashMap<String, Object>();
        data.put("category", category.label());
        data.put("items", itemData(intent.items()));

        return NotificationPayload.builder()
                .notificationId(UlidGenerator.generate())
                .title(category.emoji() + " " + category.displayName() + " Restocked!")
                .body(formatItemList(intent.items()) + " " + verb + " now in stock.")
                .badge(intent.items().size())
                .sound(itemSound(intent.device(), category))
                .threadId("stock-" + category.label())
                .category("STOCK_ALERT_" + category.name())
                .type("category_stock_alert")
                .data(data)
                .build();
    }

    private NotificationPayload premiumRestock(NotificationIntent intent) {
        if (intent.items().isEmpty() || intent.rarity() == null) {
            throw NotificationCompositionException.missingContent(intent.kind());
        }
        var item = intent.items().get(0);
        var tier = intent.rarity();
        var data = new LinkedHashMap<String, Object>();
        data.put("item_key", item.key());
        data.put("quantity", item.quantity());
        data.put("rarity", tier.label());
        if (item.category() != null) {
            data.put("category", item.category().label());
        }

        return NotificationPayload.builder()
                .notificationId(UlidGenerator.generate())
                .title(tier.emoji() + " Ultra-Rare Find!")
                .body(formatItem(item) + " is here! Super limited.")
                .badge(1)
                .sound(itemSound(intent.device(), item.category()))
                .threadId("premium-" + tier.label().toLowerCase(Locale.ROOT))
                .category("PREMIUM_ALERT_" + tier.name())
                .type("premium_stock_alert")
                .data(data)
                .build();
    }

    private NotificationPayload weather(NotificationIntent intent) {
        var deltas = intent.weather();
        if (deltas.isEmpty()) {
            throw NotificationCompositionException.missingContent(intent.kind());
        }
        var active = intent.kind() == IntentKind.WEATHER_STARTED;
        var state = active ? "active" : "ended";

        String title;
        String body;
        if (deltas.size() == 1) {
            title = WEATHER_EMOJI + " Weather " + (active ? "Started" : "Ended") + "!";
            body = deltas.get(0).name() + " is " + (active ? "now active" : "no longer active") + " in your garden.";
        } else {
            var names = deltas.stream().map(WeatherDelta::name).collect(Collectors.joining(", "));
            title = WEATHER_EMOJI + " Weather " + (active ? "Changes" : "Updates") + "!";
            body = names + " " + (active ? "are now active" : "have ended") + " in your garden.";
        }

        return NotificationPayload.builder()
                .notificationId(UlidGenerator.generate())
                .title(title)
                .body(body)
                .badge(deltas.size())
                .sound(itemSound(intent.device(), null))
                .threadId("weather-" + state)
                .category("WEATHER_" + state.toUpperCase(Locale.ROOT))
                .type("weather_" + state)
                .data(Map.of("weather_ids", deltas.stream().map(WeatherDelta::weatherId).toList()))
                .build();
    }

    private NotificationPayload event(NotificationIntent intent) {
        EventDelta event = intent.event();
        if (event == null) {
            throw NotificationCompositionException.missingContent(intent.kind());
        }
        var title = event.startingNow()
                ? EVENT_EMOJI + " " + event.eventName() + " is starting now!"
                : EVENT_EMOJI + " " + event.eventName() + " starts in " + event.minutesBefore()
                        + (event.minutesBefore() == 1 ? " minute!" : " minutes!");
        var body = event.startingNow()
                ? "Head to your garden, " + event.eventName() + " has begun."
                : "Get ready, " + event.eventName() + " begins at :" + String.format("%02d", event.triggerMinute()) + ".";

        var device = intent.device();
        var sound = device.notificationSettings().soundEnabled() ? soundFile(device.eventSettings().sound()) : null;

        return NotificationPayload.builder()
                .notificationId(UlidGenerator.generate())
                .title(title)
                .body(body)
                .badge(1)
                .sound(sound)
                .threadId("event-" + slug(event.eventName()))
                .category("EVENT_ALERT")
                .type("event_alert")
                .data(Map.of(
                        "event_name", event.eventName(),
                        "trigger_minute", event.triggerMinute(),
                        "minutes_before", event.minutesBefore()))
                .build();
    }

    static String formatItemList(List<IntentItem> items) {
        var shown = items.stream()
                .limit(MAX_LISTED_ITEMS)
                .map(DispatchComposer::formatItem)
                .collect(Collectors.joining(ITEM_SEPARATOR));
        var remaining = items.size() - MAX_LISTED_ITEMS;
        return remaining > 0 ? shown + " & " + remaining + " more" : shown;
    }

    static String formatItem(IntentItem item) {
        var name = item.displayName() != null ? item.displayName() : item.key();
        return "x" + item.quantity() + " " + name + " " + ItemEmojis.forItem(name, item.category());
    }

    private static String itemSound(DeviceRegistration device, ItemCategory category) {
        var settings = device.notificationSettings();
        if (!settings.soundEnabled()) {
            return null;
        }
        return soundFile(settings.soundFor(category).orElse(DEFAULT_SOUND));
    }

    static String soundFile(String preference) {
        if (preference == null || preference.isBlank() || DEFAULT_SOUND.equalsIgnoreCase(preference.trim())) {
            return DEFAULT_SOUND;
        }
        var name = preference.trim();
        return name.endsWith(".mp3") ? name : name + ".mp3";
    }

    private static List<Map<String, Object>> itemData(List<IntentItem> items) {
        return items.stream()
                .map(item -> Map.<String, Object>of(
                        "key", item.key(),
                        "name", item.displayName() != null ? item.displayName() : item.key(),
                        "quantity", item.quantity()))
                .toList();
    }

    private static String slug(String value) {
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
    }
}
