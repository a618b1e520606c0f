package com.gardenalert.relay.domain.catalog;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable weather view keyed by weather id. Same swap discipline as {@link CatalogSnapshot}.
 */
public final class WeatherSnapshot {

    private static final WeatherSnapshot EMPTY = new WeatherSnapshot(Map.of(), null);

    private final Map<String, WeatherCondition> conditions;
    private final Instant fetchedAt;

    private WeatherSnapshot(Map<String, WeatherCondition> conditions, Instant fetchedAt) {
        this.conditions = conditions;
        this.fetchedAt = fetchedAt;
    }

    public static WeatherSnapshot empty() {
        return EMPTY;
    }

    public static WeatherSnapshot of(Collection<WeatherCondition> conditions, Instant fetchedAt) {
        var byId = new LinkedHashMap<String, WeatherCondition>();
        for (var condition : conditions) {
            byId.put(condition.weatherId(), condition);
        }
        return new WeatherSnapshot(Collections.unmodifiableMap(byId), fetchedAt);
    }

    public Optional<WeatherCondition> get(String weatherId) {
        return Optional.ofNullable(conditions.get(weatherId));
    }

    public boolean contains(String weatherId) {
        return conditions.containsKey(weatherId);
    }

    public Collection<WeatherCondition> conditions() {
        return conditions.values();
    }

    public int size() {
        return conditions.size();
    }

    public Instant fetchedAt() {
        return fetchedAt;
    }
}
