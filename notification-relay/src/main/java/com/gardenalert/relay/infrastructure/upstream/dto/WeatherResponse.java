package com.gardenalert.relay.infrastructure.upstream.dto;

import java.util.List;

public record WeatherResponse(List<WeatherEntry> weather) {
}
