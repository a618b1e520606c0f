package com.gardenalert.relay.domain.registry;

public enum WeatherMode {
    ALL,
    FAVORITES_ONLY
}
