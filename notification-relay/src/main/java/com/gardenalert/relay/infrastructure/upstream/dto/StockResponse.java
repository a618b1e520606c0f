package com.gardenalert.relay.infrastructure.upstream.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record StockResponse(
        @JsonProperty("seed_stock") List<StockEntry> seedStock,
        @JsonProperty("gear_stock") List<StockEntry> gearStock,
        @JsonProperty("egg_stock") List<StockEntry> eggStock,
        @JsonProperty("cosmetic_stock") List<StockEntry> cosmeticStock
) {
}
