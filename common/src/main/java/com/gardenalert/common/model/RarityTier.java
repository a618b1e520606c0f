package com.gardenalert.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * Item rarity, declared lowest to highest notification priority. Ordinal order is the
 * comparison order.
 */
public enum RarityTier {
    COMMON("Common", "🌱"),
    UNCOMMON("Uncommon", "🌿"),
    RARE("Rare", "🌸"),
    LEGENDARY("Legendary", "🌟"),
    MYTHICAL("Mythical", "🔥"),
    DIVINE("Divine", "✨"),
    PRISMATIC("Prismatic", "🌈");

    private final String label;
    private final String emoji;

    RarityTier(String label, String emoji) {
        this.label = label;
        this.emoji = emoji;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String emoji() {
        return emoji;
    }

    public boolean isAbove(RarityTier other) {
        return compareTo(other) > 0;
    }

    /**
     * Parses an upstream or configured rarity label. Case-insensitive; accepts the
     * upstream spelling "Devine" for {@link #DIVINE}.
     */
    public static Optional<RarityTier> fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("DEVINE")) {
            return Optional.of(DIVINE);
        }
        for (var tier : values()) {
            if (tier.name().equals(normalized)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static RarityTier fromJson(String value) {
        return fromLabel(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown rarity tier: " + value));
    }
}
