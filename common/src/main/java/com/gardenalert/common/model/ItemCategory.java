package com.gardenalert.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Shop category an item is sold in. The label is the lowercase wire form used by the
 * upstream API and by device registrations.
 */
public enum ItemCategory {
    SEEDS("seeds", "Seeds", "🌱"),
    GEAR("gear", "Gear", "⚙️"),
    EGGS("eggs", "Eggs", "🥚"),
    COSMETIC("cosmetic", "Cosmetic", "🎨");

    private final String label;
    private final String displayName;
    private final String emoji;

    ItemCategory(String label, String displayName, String emoji) {
        this.label = label;
        this.displayName = displayName;
        this.emoji = emoji;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String displayName() {
        return displayName;
    }

    public String emoji() {
        return emoji;
    }

    public static Optional<ItemCategory> fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.label.equals(normalized) || c.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }

    @JsonCreator
    public static ItemCategory fromJson(String value) {
        return fromLabel(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown item category: " + value));
    }
}
