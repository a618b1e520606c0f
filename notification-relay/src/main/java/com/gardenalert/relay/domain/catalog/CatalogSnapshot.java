package com.gardenalert.relay.domain.catalog;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable point-in-time view of the shop, keyed by item key. Built once per fetch and
 * never mutated afterwards.
 */
public final class CatalogSnapshot {

    private static final CatalogSnapshot EMPTY = new CatalogSnapshot(Map.of(), null);

    private final Map<String, CatalogItem> items;
    private final Instant fetchedAt;

    private CatalogSnapshot(Map<String, CatalogItem> items, Instant fetchedAt) {
        this.items = items;
        this.fetchedAt = fetchedAt;
    }

    public static CatalogSnapshot empty() {
        return EMPTY;
    }

    /**
     * Later entries with the same key replace earlier ones.
     */
    public static CatalogSnapshot of(Collection<CatalogItem> items, Instant fetchedAt) {
        var byKey = new LinkedHashMap<String, CatalogItem>();
        for (var item : items) {
            byKey.put(item.key(), item);
        }
        return new CatalogSnapshot(Collections.unmodifiableMap(byKey), fetchedAt);
    }

    public Optional<CatalogItem> get(String key) {
        return Optional.ofNullable(items.get(key));
    }

    public int quantityOf(String key) {
        var item = items.get(key);
        return item == null ? 0 : item.quantity();
    }

    public Collection<CatalogItem> items() {
        return items.values();
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * @return when the data was fetched, or {@code null} for the empty snapshot
     */
    public Instant fetchedAt() {
        return fetchedAt;
    }
}
