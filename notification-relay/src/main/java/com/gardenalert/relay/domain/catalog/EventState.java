package com.gardenalert.relay.domain.catalog;

/**
 * The single active timed event. {@code correctedTriggerMinute} is the minute of the hour
 * the event starts, after the configured correction has been applied.
 */
public record EventState(String name, int correctedTriggerMinute) {

    public EventState {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Event name must not be blank");
        }
        if (correctedTriggerMinute < 0 || correctedTriggerMinute > 59) {
            throw new IllegalArgumentException("Trigger minute must be 0-59: " + correctedTriggerMinute);
        }
    }
}
