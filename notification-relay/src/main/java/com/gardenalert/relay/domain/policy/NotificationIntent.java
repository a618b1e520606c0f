package com.gardenalert.relay.domain.policy;

import com.gardenalert.common.model.ItemCategory;
import com.gardenalert.common.model.RarityTier;
import com.gardenalert.relay.domain.detection.EventDelta;
import com.gardenalert.relay.domain.detection.WeatherDelta;
import com.gardenalert.relay.domain.registry.DeviceRegistration;
import java.util.List;
import lombok.Builder;

/**
 * Approved decision to notify one device about one change. Which fields are populated
 * depends on {@link #kind()}: items for restocks, weather for weather, event for events.
 */
@Builder(toBuilder = true)
public record NotificationIntent(
        DeviceRegistration device,
        IntentKind kind,
        ItemCategory category,
        RarityTier rarity,
        List<IntentItem> items,
        List<WeatherDelta> weather,
        EventDelta event
) {

    public NotificationIntent {
        items = items == null ? List.of() : List.copyOf(items);
        weather = weather == null ? List.of() : List.copyOf(weather);
    }

    public String deviceToken() {
        return device.deviceToken();
    }
}
