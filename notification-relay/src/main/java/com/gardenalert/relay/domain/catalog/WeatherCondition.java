package com.gardenalert.relay.domain.catalog;

import lombok.Builder;

@Builder(toBuilder = true)
public record WeatherCondition(
        String weatherId,
        String name,
        boolean active,
        long durationSeconds
) {

    public WeatherCondition {
        if (weatherId == null || weatherId.isBlank()) {
            throw new IllegalArgumentException("Weather id must not be blank");
        }
        if (name == null || name.isBlank()) {
            name = weatherId;
        }
    }
}
