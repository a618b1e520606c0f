package com.gardenalert.relay.domain.registry;

import com.gardenalert.common.model.ItemCategory;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Master switch for a device plus its sound choice per item category.
 */
public record NotificationSettings(boolean enabled, boolean soundEnabled, Map<ItemCategory, String> perCategorySound) {

    public NotificationSettings {
        perCategorySound = perCategorySound == null || perCategorySound.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(perCategorySound));
    }

    public static NotificationSettings defaults() {
        return new NotificationSettings(true, true, Map.of());
    }

    public Optional<String> soundFor(ItemCategory category) {
        return Optional.ofNullable(category).map(perCategorySound::get);
    }
}
