package com.gardenalert.relay.domain.rarity;

import com.gardenalert.common.model.RarityTier;

public record ResolvedRarity(RarityTier tier, RaritySource source) {

    public boolean isUnclassified() {
        return source == RaritySource.DEFAULT;
    }
}
