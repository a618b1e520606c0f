package com.gardenalert.relay.infrastructure.upstream.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StockEntry(
        @JsonProperty("item_id") String itemId,
        @JsonProperty("display_name") String displayName,
        Integer quantity,
        String icon,
        String rarity
) {
}
