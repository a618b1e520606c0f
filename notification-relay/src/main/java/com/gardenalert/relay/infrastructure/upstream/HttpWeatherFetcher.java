package com.gardenalert.relay.infrastructure.upstream;

import com.gardenalert.relay.domain.catalog.WeatherFetcher;
import com.gardenalert.relay.domain.catalog.WeatherSnapshot;
import com.gardenalert.relay.infrastructure.upstream.dto.WeatherEntry;
import com.gardenalert.relay.infrastructure.upstream.mapper.WeatherConditionMapper;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class HttpWeatherFetcher implements WeatherFetcher {

    private final GameDataClient gameDataClient;
    private final WeatherConditionMapper weatherConditionMapper;
    private final Clock clock;

    @Override
    public WeatherSnapshot fetchWeather() {
        var response = gameDataClient.fetchWeather();
        var entries = response.weather() == null ? List.<WeatherEntry>of() : response.weather().stream()
                .filter(entry -> entry.weatherId() != null && !entry.weatherId().isBlank())
                .toList();
        return WeatherSnapshot.of(weatherConditionMapper.toDomain(entries), clock.instant());
    }
}
