package com.gardenalert.relay.domain.catalog;

import com.gardenalert.common.model.ItemCategory;
import lombok.Builder;

/**
 * One shop entry. {@code key} is the display name the upstream uses and the key device
 * favorites refer to; {@code upstreamRarity} is whatever label the API declared, if any.
 */
@Builder(toBuilder = true)
public record CatalogItem(
        String key,
        String displayName,
        String itemId,
        ItemCategory category,
        int quantity,
        String upstreamRarity,
        String icon
) {

    public CatalogItem {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Catalog item key must not be blank");
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity must be >= 0 for " + key + ": " + quantity);
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = key;
        }
    }

    public boolean inStock() {
        return quantity > 0;
    }
}
