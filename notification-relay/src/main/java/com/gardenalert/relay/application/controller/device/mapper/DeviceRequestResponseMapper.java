package com.gardenalert.relay.application.controller.device.mapper;

import com.gardenalert.common.model.ItemCategory;
import com.gardenalert.relay.application.controller.device.RegisterDeviceRequest;
import com.gardenalert.relay.application.controller.device.RegisterDeviceRequest.EventSettingsRequest;
import com.gardenalert.relay.application.controller.device.RegisterDeviceRequest.NotificationSettingsRequest;
import com.gardenalert.relay.application.controller.device.RegisterDeviceRequest.WeatherSettingsRequest;
import com.gardenalert.relay.application.controller.device.RegisterDeviceResponse;
import com.gardenalert.relay.domain.exceptions.InvalidRegistrationException;
import com.gardenalert.relay.domain.registry.DeviceRegistration;
import com.gardenalert.relay.domain.registry.DeviceTokens;
import com.gardenalert.relay.domain.registry.EventSettings;
import com.gardenalert.relay.domain.registry.NotificationSettings;
import com.gardenalert.relay.domain.registry.WeatherMode;
import com.gardenalert.relay.domain.registry.WeatherSettings;
import java.util.EnumMap;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring", imports = DeviceTokens.class)
public interface DeviceRequestResponseMapper {

    @Mapping(target = "favoriteItemKeys", source = "favoriteItems")
    @Mapping(target = "favoriteWeatherIds", source = "favoriteWeather")
    @Mapping(target = "registeredAt", ignore = true)
    DeviceRegistration toDomain(RegisterDeviceRequest request);

    @Mapping(target = "deviceToken", expression = "java(DeviceTokens.mask(registration.deviceToken()))")
    @Mapping(target = "favoriteItemCount", expression = "java(registration.favoriteItemKeys().size())")
    @Mapping(target = "favoriteWeatherCount", expression = "java(registration.favoriteWeatherIds().size())")
    @Mapping(target = "notificationsEnabled", source = "notificationSettings.enabled")
    @Mapping(target = "weatherEnabled", source = "weatherSettings.enabled")
    @Mapping(target = "eventsEnabled", source = "eventSettings.enabled")
    RegisterDeviceResponse toResponse(DeviceRegistration registration);

    default NotificationSettings toNotificationSettings(NotificationSettingsRequest request) {
        if (request == null) {
            return NotificationSettings.defaults();
        }
        var sounds = new EnumMap<ItemCategory, String>(ItemCategory.class);
        if (request.categorySounds() != null) {
            for (Map.Entry<String, String> entry : request.categorySounds().entrySet()) {
                var category = ItemCategory.fromLabel(entry.getKey())
                        .orElseThrow(() -> InvalidRegistrationException.unknownCategory(entry.getKey()));
                if (entry.getValue() != null && !entry.getValue().isBlank()) {
                    sounds.put(category, entry.getValue().trim());
                }
            }
        }
        return new NotificationSettings(
                request.enabled() == null || request.enabled(),
                request.sound() == null || request.sound(),
                sounds);
    }

    default WeatherSettings toWeatherSettings(WeatherSettingsRequest request) {
        if (request == null) {
            return WeatherSettings.defaults();
        }
        return new WeatherSettings(
                request.enabled() == null || request.enabled(),
                request.mode() == null ? WeatherMode.ALL : request.mode());
    }

    default EventSettings toEventSettings(EventSettingsRequest request) {
        if (request == null) {
            return EventSettings.defaults();
        }
        return new EventSettings(
                request.enabled() != null && request.enabled(),
                request.leadMinutes() == null ? EventSettings.DEFAULT_LEAD_MINUTES : request.leadMinutes(),
                request.sound());
    }
}
