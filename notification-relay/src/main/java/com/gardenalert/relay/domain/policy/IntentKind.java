package com.gardenalert.relay.domain.policy;

public enum IntentKind {
    CATEGORY_RESTOCK,
    PREMIUM_RESTOCK,
    WEATHER_STARTED,
    WEATHER_ENDED,
    EVENT_UPCOMING
}
