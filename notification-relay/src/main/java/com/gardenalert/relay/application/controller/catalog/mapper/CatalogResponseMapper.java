package com.gardenalert.relay.application.controller.catalog.mapper;

import com.gardenalert.relay.application.controller.catalog.CatalogItemResponse;
import com.gardenalert.relay.application.controller.catalog.WeatherResponse;
import com.gardenalert.relay.domain.catalog.CatalogItem;
import com.gardenalert.relay.domain.catalog.WeatherCondition;
import com.gardenalert.relay.domain.rarity.ResolvedRarity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface CatalogResponseMapper {

    @Mapping(target = "rarity", source = "resolved.tier")
    @Mapping(target = "raritySource", source = "resolved.source")
    CatalogItemResponse toResponse(CatalogItem item, ResolvedRarity resolved);

    WeatherResponse toResponse(WeatherCondition condition);
}
