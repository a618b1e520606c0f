package com.gardenalert.relay.infrastructure.rarity;

import com.gardenalert.common.model.RarityTier;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Reads the {@code name,tier} classification table. The first line is a header. An
 * unreadable file fails startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RarityClassificationLoader {

    private final ResourceLoader resourceLoader;

    public Map<String, RarityTier> load(String location) {
        Map<String, RarityTier> table = new LinkedHashMap<>();
        var resource = resourceLoader.getResource(location);
        try (var reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            var header = true;
            while ((line = reader.readLine()) != null) {
                if (header) {
                    header = false;
                    continue;
                }
                var trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                var parts = trimmed.split(",");
                if (parts.length < 2) {
                    log.warn("Skipping malformed classification line: {}", trimmed);
                    continue;
                }
                var name = parts[0].trim();
                var tier = RarityTier.fromLabel(parts[1]);
                if (tier.isEmpty()) {
                    log.warn("Skipping {}: unknown tier '{}'", name, parts[1].trim());
                    continue;
                }
                table.put(name, tier.get());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load rarity classification from " + location, e);
        }
        log.info("Loaded {} rarity classifications from {}", table.size(), location);
        return Collections.unmodifiableMap(table);
    }
}
