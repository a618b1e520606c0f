package com.gardenalert.relay.domain.detection;

import java.util.List;
import java.util.Optional;

public record DetectedChanges(List<ItemDelta> itemDeltas, List<WeatherDelta> weatherDeltas, EventDelta eventDelta) {

    public DetectedChanges {
        itemDeltas = List.copyOf(itemDeltas);
        weatherDeltas = List.copyOf(weatherDeltas);
    }

    public static DetectedChanges itemsOnly(List<ItemDelta> itemDeltas) {
        return new DetectedChanges(itemDeltas, List.of(), null);
    }

    public Optional<EventDelta> event() {
        return Optional.ofNullable(eventDelta);
    }

    public boolean isEmpty() {
        return itemDeltas.isEmpty() && weatherDeltas.isEmpty() && eventDelta == null;
    }
}
