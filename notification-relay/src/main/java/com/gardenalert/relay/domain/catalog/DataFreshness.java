package com.gardenalert.relay.domain.catalog;

import com.fasterxml.jackson.annotation.JsonValue;
import java.time.Duration;
import java.time.Instant;

/**
 * Coarse age rating for the last successful upstream update.
 */
public enum DataFreshness {
    EXCELLENT("excellent", Duration.ofSeconds(30)),
    GOOD("good", Duration.ofSeconds(60)),
    FAIR("fair", Duration.ofMinutes(5)),
    STALE("stale", Duration.ofMinutes(10)),
    VERY_STALE("very_stale", null),
    UNKNOWN("unknown", null);

    private final String label;
    private final Duration below;

    DataFreshness(String label, Duration below) {
        this.label = label;
        this.below = below;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static DataFreshness rate(Instant updatedAt, Instant now) {
        if (updatedAt == null) {
            return UNKNOWN;
        }
        var age = Duration.between(updatedAt, now);
        for (var rating : values()) {
            if (rating.below != null && age.compareTo(rating.below) < 0) {
                return rating;
            }
        }
        return VERY_STALE;
    }
}
