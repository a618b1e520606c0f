package com.gardenalert.relay.application.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gardenalert.common.json.JacksonConfig;
import com.gardenalert.relay.domain.dedup.DeduplicationCache;
import com.gardenalert.relay.domain.detection.ChangeDetector;
import com.gardenalert.relay.domain.policy.NotificationPolicyEngine;
import com.gardenalert.relay.domain.rarity.RarityResolver;
import com.gardenalert.relay.infrastructure.rarity.RarityClassificationLoader;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.json.ProblemDetailJacksonMixin;

/**
 * Wires the domain components that carry no Spring annotations, plus the shared ObjectMapper.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RelayProperties.class)
public class RelayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        var mapper = JacksonConfig.createObjectMapper();
        mapper.addMixIn(ProblemDetail.class, ProblemDetailJacksonMixin.class);
        return mapper;
    }

    @Bean
    public RarityResolver rarityResolver(RelayProperties properties, RarityClassificationLoader loader) {
        var rarity = properties.rarity();
        var resolver = new RarityResolver(rarity.overrides(), loader.load(rarity.classificationFile()));
        log.info("Rarity resolver ready: {} overrides, {} classified names",
                resolver.overrideCount(), resolver.classifiedCount());
        return resolver;
    }

    @Bean
    public ChangeDetector changeDetector(RelayProperties properties) {
        return new ChangeDetector(properties.event().toleranceSeconds());
    }

    @Bean
    public NotificationPolicyEngine notificationPolicyEngine(
            RarityResolver rarityResolver, RelayProperties properties) {
        return new NotificationPolicyEngine(rarityResolver, properties.policy().premiumTier());
    }

    @Bean
    public DeduplicationCache deduplicationCache(RelayProperties properties) {
        return new DeduplicationCache(properties.dedup().window());
    }
}
