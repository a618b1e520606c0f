package com.gardenalert.relay.domain.registry;

public record WeatherSettings(boolean enabled, WeatherMode mode) {

    public WeatherSettings {
        if (mode == null) {
            mode = WeatherMode.ALL;
        }
    }

    public static WeatherSettings defaults() {
        return new WeatherSettings(true, WeatherMode.ALL);
    }
}
