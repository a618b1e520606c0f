package com.gardenalert.relay.domain.policy;

import com.gardenalert.common.model.ItemCategory;
import com.gardenalert.common.model.RarityTier;
import lombok.Builder;

@Builder
public record IntentItem(
        String key,
        String displayName,
        ItemCategory category,
        RarityTier rarity,
        int quantity,
        int previousQuantity
) {
}
