package com.gardenalert.relay.domain.detection;

import com.gardenalert.common.model.ItemCategory;
import lombok.Builder;

@Builder(toBuilder = true)
public record ItemDelta(
        String key,
        String displayName,
        String itemId,
        String upstreamRarity,
        ItemCategory category,
        int previousQty,
        int currentQty
) {

    public boolean quantityChanged() {
        return previousQty != currentQty;
    }

    public boolean wasOutOfStock() {
        return previousQty == 0;
    }
}
