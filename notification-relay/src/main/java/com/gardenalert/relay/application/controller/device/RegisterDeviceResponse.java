package com.gardenalert.relay.application.controller.device;

import java.time.Instant;

public record RegisterDeviceResponse(
        String deviceToken,
        int favoriteItemCount,
        int favoriteWeatherCount,
        boolean notificationsEnabled,
        boolean weatherEnabled,
        boolean eventsEnabled,
        Instant registeredAt) {}
