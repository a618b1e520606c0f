package com.gardenalert.relay.domain.registry;

import java.time.Instant;
import java.util.Set;
import lombok.Builder;

/**
 * Everything the engine knows about one device. Replaced wholesale on each registration;
 * missing settings resolve to their defaults here, once.
 */
@Builder(toBuilder = true)
public record DeviceRegistration(
        String deviceToken,
        String platform,
        String appVersion,
        Set<String> favoriteItemKeys,
        Set<String> favoriteWeatherIds,
        NotificationSettings notificationSettings,
        WeatherSettings weatherSettings,
        EventSettings eventSettings,
        Instant registeredAt
) {

    public DeviceRegistration {
        if (deviceToken == null || deviceToken.isBlank()) {
            throw new IllegalArgumentException("Device token must not be blank");
        }
        favoriteItemKeys = favoriteItemKeys == null ? Set.of() : Set.copyOf(favoriteItemKeys);
        favoriteWeatherIds = favoriteWeatherIds == null ? Set.of() : Set.copyOf(favoriteWeatherIds);
        notificationSettings = notificationSettings == null ? NotificationSettings.defaults() : notificationSettings;
        weatherSettings = weatherSettings == null ? WeatherSettings.defaults() : weatherSettings;
        eventSettings = eventSettings == null ? EventSettings.defaults() : eventSettings;
    }

    public boolean notificationsEnabled() {
        return notificationSettings.enabled();
    }

    public boolean isFavoriteItem(String itemKey) {
        return favoriteItemKeys.contains(itemKey);
    }

    public boolean isFavoriteWeather(String weatherId) {
        return favoriteWeatherIds.contains(weatherId);
    }
}
