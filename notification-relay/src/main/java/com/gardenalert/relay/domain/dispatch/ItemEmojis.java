package com.gardenalert.relay.domain.dispatch;

import com.gardenalert.common.model.ItemCategory;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Emoji shown next to an item name. Matching is by substring of the lowercased name;
 * multi-word names are listed before the single words they contain.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ItemEmojis {

    static final String FALLBACK = "📦";
    private static final String EGG = "🥚";

    private static final Map<String, String> SEEDS = new LinkedHashMap<>();
    private static final Map<String, String> GEAR = new LinkedHashMap<>();

    static {
        SEEDS.put("sugar apple", "🌺");
        SEEDS.put("dragon fruit", "🐉");
        SEEDS.put("orange tulip", "🌷");
        SEEDS.put("burning bud", "🔥");
        SEEDS.put("ember lily", "🔥");
        SEEDS.put("bamboo", "🎋");
        SEEDS.put("tomato", "🍅");
        SEEDS.put("mango", "🥭");
        SEEDS.put("cactus", "🌵");
        SEEDS.put("apple", "🍎");
        SEEDS.put("grape", "🍇");
        SEEDS.put("watermelon", "🍉");
        SEEDS.put("strawberry", "🍓");
        SEEDS.put("pumpkin", "🎃");
        SEEDS.put("pepper", "🌶️");
        SEEDS.put("mushroom", "🍄");
        SEEDS.put("cacao", "🍫");
        SEEDS.put("avocado", "🥑");
        SEEDS.put("blueberry", "🫐");
        SEEDS.put("carrot", "🥕");
        SEEDS.put("coconut", "🥥");
        SEEDS.put("beanstalk", "🌱");
        SEEDS.put("daffodil", "🌼");

        GEAR.put("watering can", "🪣");
        GEAR.put("trowel", "🔧");
        GEAR.put("magnifying glass", "🔍");
        GEAR.put("cleaning spray", "🧴");
        GEAR.put("recall wrench", "🔧");
        GEAR.put("sprinkler", "💦");
        GEAR.put("tanning mirror", "🪞");
        GEAR.put("favorite tool", "⭐");
        GEAR.put("harvest tool", "🛠️");
        GEAR.put("friendship pot", "🍯");
    }

    public static String forItem(String name, ItemCategory category) {
        var lower = name == null ? "" : name.toLowerCase(Locale.ROOT);
        var match = firstMatch(SEEDS, lower);
        if (match == null) {
            match = firstMatch(GEAR, lower);
        }
        if (match != null) {
            return match;
        }
        if (lower.contains("egg")) {
            return EGG + eggSuffix(lower);
        }
        return category != null ? category.emoji() : FALLBACK;
    }

    private static String firstMatch(Map<String, String> table, String lowerName) {
        for (var entry : table.entrySet()) {
            if (lowerName.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String eggSuffix(String lowerName) {
        if (lowerName.contains("bee")) {
            return "🐝";
        } else if (lowerName.contains("bug")) {
            return "🐛";
        } else if (lowerName.contains("rare") || lowerName.contains("legendary")) {
            return "✨";
        } else if (lowerName.contains("paradise") || lowerName.contains("summer")) {
            return "🌟";
        }
        return "";
    }
}
