package com.gardenalert.relay.infrastructure.upstream;

import com.gardenalert.common.model.ItemCategory;
import com.gardenalert.relay.domain.catalog.CatalogItem;
import com.gardenalert.relay.domain.catalog.CatalogSnapshot;
import com.gardenalert.relay.infrastructure.upstream.dto.StockEntry;
import com.gardenalert.relay.infrastructure.upstream.dto.StockResponse;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Flattens the four stock arrays into one snapshot keyed by display name. Eggs are
 * special: "location" entries are dropped and repeated egg names are summed.
 */
@Slf4j
@Component
public class CatalogNormalizer {

    private static final String EGG_LOCATION_MARKER = "location";

    public CatalogSnapshot normalize(StockResponse response, Instant fetchedAt) {
        var items = new LinkedHashMap<String, CatalogItem>();
        addAll(items, response.seedStock(), ItemCategory.SEEDS);
        addAll(items, response.gearStock(), ItemCategory.GEAR);
        addEggs(items, response.eggStock());
        addAll(items, response.cosmeticStock(), ItemCategory.COSMETIC);
        return CatalogSnapshot.of(items.values(), fetchedAt);
    }

    private void addAll(Map<String, CatalogItem> items, List<StockEntry> entries, ItemCategory category) {
        if (entries == null) {
            return;
        }
        for (var entry : entries) {
            if (isBlank(entry.displayName())) {
                log.debug("Skipping {} entry without a display name (item_id={})", category.label(), entry.itemId());
                continue;
            }
            var item = toItem(entry, category);
            items.put(item.key(), item);
        }
    }

    private void addEggs(Map<String, CatalogItem> items, List<StockEntry> entries) {
        if (entries == null) {
            return;
        }
        for (var entry : entries) {
            if (isBlank(entry.displayName())
                    || entry.displayName().toLowerCase(Locale.ROOT).contains(EGG_LOCATION_MARKER)) {
                continue;
            }
            var incoming = toItem(entry, ItemCategory.EGGS);
            items.merge(incoming.key(), incoming, CatalogNormalizer::aggregateEggs);
        }
    }

    private static CatalogItem aggregateEggs(CatalogItem existing, CatalogItem incoming) {
        return existing.toBuilder()
                .quantity(existing.quantity() + incoming.quantity())
                .upstreamRarity(isBlank(incoming.upstreamRarity()) ? existing.upstreamRarity() : incoming.upstreamRarity())
                .icon(isBlank(incoming.icon()) ? existing.icon() : incoming.icon())
                .build();
    }

    private static CatalogItem toItem(StockEntry entry, ItemCategory category) {
        var name = entry.displayName().trim();
        return CatalogItem.builder()
                .key(name)
                .displayName(name)
                .itemId(entry.itemId())
                .category(category)
                .quantity(entry.quantity() == null ? 0 : Math.max(0, entry.quantity()))
                .upstreamRarity(entry.rarity())
                .icon(entry.icon())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
