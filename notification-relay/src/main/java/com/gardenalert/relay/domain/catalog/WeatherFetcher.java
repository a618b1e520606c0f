package com.gardenalert.relay.domain.catalog;

public interface WeatherFetcher {

    WeatherSnapshot fetchWeather();
}
