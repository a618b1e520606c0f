package com.gardenalert.relay.domain.catalog;

import java.time.Instant;

/**
 * What the store holds after one swap. {@code catalogFresh} is false when the catalog fetch
 * failed and {@code currentCatalog} was carried over from the prior cycle.
 */
public record SnapshotGeneration(
        CatalogSnapshot previousCatalog,
        CatalogSnapshot currentCatalog,
        WeatherSnapshot previousWeather,
        WeatherSnapshot currentWeather,
        boolean catalogFresh,
        Instant catalogUpdatedAt,
        Instant weatherUpdatedAt
) {

    static SnapshotGeneration initial() {
        return new SnapshotGeneration(
                CatalogSnapshot.empty(),
                CatalogSnapshot.empty(),
                WeatherSnapshot.empty(),
                WeatherSnapshot.empty(),
                false,
                null,
                null);
    }
}
