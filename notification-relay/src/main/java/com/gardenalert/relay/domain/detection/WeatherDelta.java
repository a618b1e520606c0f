package com.gardenalert.relay.domain.detection;

import lombok.Builder;

@Builder(toBuilder = true)
public record WeatherDelta(
        String weatherId,
        String name,
        boolean active,
        boolean wasActive,
        long durationSeconds
) {
}
