package com.gardenalert.relay.domain.rarity;

import com.gardenalert.common.model.RarityTier;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Layered rarity lookup: override by item id, then the upstream label, then the static
 * name table, then {@link #DEFAULT_TIER}. Pure; callers log unclassified items.
 *
 * <p>The default sits above {@link RarityTier#COMMON}: an unclassified item notifies.
 */
public class RarityResolver {

    public static final RarityTier DEFAULT_TIER = RarityTier.RARE;

    private final Map<String, RarityTier> overridesByItemId;
    private final Map<String, RarityTier> classificationByName;

    public RarityResolver(Map<String, RarityTier> overridesByItemId, Map<String, RarityTier> classificationByName) {
        this.overridesByItemId = Map.copyOf(overridesByItemId);
        this.classificationByName = classificationByName.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(e -> normalize(e.getKey()), Map.Entry::getValue));
    }

    public RarityTier resolveRarity(String itemKey, String itemId, String upstreamRarity) {
        return resolve(itemKey, itemId, upstreamRarity).tier();
    }

    public ResolvedRarity resolve(String itemKey, String itemId, String upstreamRarity) {
        if (itemId != null) {
            var override = overridesByItemId.get(itemId);
            if (override != null) {
                return new ResolvedRarity(override, RaritySource.OVERRIDE);
            }
        }

        var upstream = RarityTier.fromLabel(upstreamRarity);
        if (upstream.isPresent()) {
            return new ResolvedRarity(upstream.get(), RaritySource.UPSTREAM);
        }

        if (itemKey != null) {
            var classified = classificationByName.get(normalize(itemKey));
            if (classified != null) {
                return new ResolvedRarity(classified, RaritySource.CLASSIFICATION_TABLE);
            }
        }

        return new ResolvedRarity(DEFAULT_TIER, RaritySource.DEFAULT);
    }

    public int overrideCount() {
        return overridesByItemId.size();
    }

    public int classifiedCount() {
        return classificationByName.size();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
