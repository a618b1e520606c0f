package com.gardenalert.relay.domain.registry;

import com.gardenalert.relay.domain.detection.ChangeDetector;

/**
 * Lead minutes are checked against {@link ChangeDetector#EVENT_LEAD_MINUTES} at registration.
 */
public record EventSettings(boolean enabled, int leadMinutes, String sound) {

    public static final int DEFAULT_LEAD_MINUTES = 5;
    public static final String DEFAULT_SOUND = "default";

    public EventSettings {
        if (sound == null || sound.isBlank()) {
            sound = DEFAULT_SOUND;
        }
    }

    public static EventSettings defaults() {
        return new EventSettings(false, DEFAULT_LEAD_MINUTES, DEFAULT_SOUND);
    }

    public static boolean isSupportedLead(int leadMinutes) {
        return ChangeDetector.EVENT_LEAD_MINUTES.contains(leadMinutes);
    }
}
