package com.gardenalert.relay.domain.detection;

/**
 * Both modes emit every tracked item with quantity above zero. RESTOCK runs on each poll
 * cycle after a swap; AVAILABILITY is an on-demand re-check of the current snapshot.
 */
public enum DetectionMode {
    RESTOCK,
    AVAILABILITY
}
