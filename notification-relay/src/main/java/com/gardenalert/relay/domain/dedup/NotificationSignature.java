package com.gardenalert.relay.domain.dedup;

import com.gardenalert.relay.domain.detection.WeatherDelta;
import com.gardenalert.relay.domain.policy.IntentItem;
import com.gardenalert.relay.domain.policy.NotificationIntent;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Canonical identity of a notification's content. Keys are sorted before joining so a
 * reordered upstream response produces the same signature.
 */
public record NotificationSignature(String value) {

    private static final String KEY_DELIMITER = ",";

    public NotificationSignature {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Signature must not be blank");
        }
    }

    public static NotificationSignature of(NotificationIntent intent) {
        return new NotificationSignature(switch (intent.kind()) {
            case CATEGORY_RESTOCK -> "stock:" + intent.category().label() + ":" + itemKeys(intent);
            case PREMIUM_RESTOCK -> "premium:" + intent.rarity().label().toLowerCase(Locale.ROOT) + ":" + itemKeys(intent);
            case WEATHER_STARTED -> "weather-started:" + weatherIds(intent);
            case WEATHER_ENDED -> "weather-ended:" + weatherIds(intent);
            case EVENT_UPCOMING -> "event:" + intent.event().eventName() + ":" + intent.event().minutesBefore();
        });
    }

    private static String itemKeys(NotificationIntent intent) {
        return intent.items().stream()
                .map(IntentItem::key)
                .sorted()
                .collect(Collectors.joining(KEY_DELIMITER));
    }

    private static String weatherIds(NotificationIntent intent) {
        return intent.weather().stream()
                .map(WeatherDelta::weatherId)
                .sorted()
                .collect(Collectors.joining(KEY_DELIMITER));
    }

    @Override
    public String toString() {
        return value;
    }
}
