package com.gardenalert.relay.domain.catalog;

/**
 * Domain port for the upstream stock feed. Throws
 * {@link com.gardenalert.relay.domain.exceptions.UpstreamUnavailableException} on failure.
 */
public interface CatalogFetcher {

    CatalogSnapshot fetchCatalog();
}
