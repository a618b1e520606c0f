package com.gardenalert.relay.infrastructure.upstream.mapper;

import com.gardenalert.relay.domain.catalog.WeatherCondition;
import com.gardenalert.relay.infrastructure.upstream.dto.WeatherEntry;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface WeatherConditionMapper {

    @Mapping(target = "name", source = "weatherName")
    @Mapping(target = "durationSeconds", source = "duration")
    WeatherCondition toDomain(WeatherEntry entry);

    List<WeatherCondition> toDomain(List<WeatherEntry> entries);
}
