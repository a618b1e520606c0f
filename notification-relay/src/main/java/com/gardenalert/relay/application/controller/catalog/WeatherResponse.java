package com.gardenalert.relay.application.controller.catalog;

public record WeatherResponse(String weatherId, String name, boolean active, long durationSeconds) {}
