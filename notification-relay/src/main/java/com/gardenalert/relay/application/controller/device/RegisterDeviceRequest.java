package com.gardenalert.relay.application.controller.device;

import com.gardenalert.relay.domain.registry.WeatherMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;
import java.util.Set;

/**
 * Full device state; every call replaces the previous registration. Omitted settings
 * blocks take their defaults.
 */
public record RegisterDeviceRequest(
        @NotBlank @Size(max = 256)
        String deviceToken,

        @Size(max = 32)
        String platform,

        @Size(max = 32)
        String appVersion,

        @Size(max = 500)
        Set<@NotBlank String> favoriteItems,

        @Size(max = 100)
        Set<@NotBlank String> favoriteWeather,

        @Valid
        NotificationSettingsRequest notificationSettings,

        @Valid
        WeatherSettingsRequest weatherSettings,

        @Valid
        EventSettingsRequest eventSettings
) {

    public record NotificationSettingsRequest(Boolean enabled, Boolean sound, Map<String, String> categorySounds) {}

    public record WeatherSettingsRequest(Boolean enabled, WeatherMode mode) {}

    public record EventSettingsRequest(Boolean enabled, Integer leadMinutes, @Size(max = 64) String sound) {}
}
