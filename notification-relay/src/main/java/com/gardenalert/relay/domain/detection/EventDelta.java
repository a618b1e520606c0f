package com.gardenalert.relay.domain.detection;

/**
 * An event check that matched: the event starts {@code minutesBefore} minutes after now.
 */
public record EventDelta(String eventName, int triggerMinute, int minutesBefore) {

    public boolean startingNow() {
        return minutesBefore == 0;
    }
}
