package com.gardenalert.relay.infrastructure.upstream.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WeatherEntry(
        @JsonProperty("weather_id") String weatherId,
        @JsonProperty("weather_name") String weatherName,
        Boolean active,
        Long duration
) {
}
