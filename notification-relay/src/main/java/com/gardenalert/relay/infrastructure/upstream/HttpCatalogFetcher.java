package com.gardenalert.relay.infrastructure.upstream;

import com.gardenalert.relay.domain.catalog.CatalogFetcher;
import com.gardenalert.relay.domain.catalog.CatalogSnapshot;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class HttpCatalogFetcher implements CatalogFetcher {

    private final GameDataClient gameDataClient;
    private final CatalogNormalizer normalizer;
    private final Clock clock;

    @Override
    public CatalogSnapshot fetchCatalog() {
        var snapshot = normalizer.normalize(gameDataClient.fetchStock(), clock.instant());
        log.debug("Catalog fetched: {} items", snapshot.size());
        return snapshot;
    }
}
