package com.gardenalert.relay.infrastructure.upstream;

import com.gardenalert.relay.application.config.RelayProperties;
import com.gardenalert.relay.domain.exceptions.UpstreamUnavailableException;
import com.gardenalert.relay.infrastructure.upstream.dto.EventResponse;
import com.gardenalert.relay.infrastructure.upstream.dto.StockResponse;
import com.gardenalert.relay.infrastructure.upstream.dto.WeatherResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Thin client for the game-data API. Every failure surfaces as
 * {@link UpstreamUnavailableException}; timeouts are configured on the underlying client.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameDataClient {

    static final String API_KEY_HEADER = "jstudio-key";

    private final RestClient gameDataRestClient;
    private final RelayProperties properties;

    public StockResponse fetchStock() {
        return get(properties.upstream().stockPath(), StockResponse.class, "stock");
    }

    public WeatherResponse fetchWeather() {
        return get(properties.upstream().weatherPath(), WeatherResponse.class, "weather");
    }

    public EventResponse fetchEvent() {
        return get(properties.upstream().eventPath(), EventResponse.class, "event");
    }

    private <T> T get(String path, Class<T> type, String source) {
        var apiKey = properties.upstream().apiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw UpstreamUnavailableException.notConfigured(source);
        }

        T body;
        try {
            body = gameDataRestClient.get()
                    .uri(path)
                    .header(API_KEY_HEADER, apiKey)
                    .retrieve()
                    .body(type);
        } catch (RestClientException e) {
            throw UpstreamUnavailableException.requestFailed(source, e);
        }
        if (body == null) {
            throw UpstreamUnavailableException.emptyResponse(source);
        }
        log.debug("Fetched {} from {}", source, path);
        return body;
    }
}
