package com.gardenalert.relay.application.controller.catalog;

import com.gardenalert.common.model.ItemCategory;
import com.gardenalert.common.model.RarityTier;
import com.gardenalert.relay.domain.rarity.RaritySource;

public record CatalogItemResponse(
        String key,
        String displayName,
        String itemId,
        ItemCategory category,
        int quantity,
        RarityTier rarity,
        RaritySource raritySource,
        String icon) {}
