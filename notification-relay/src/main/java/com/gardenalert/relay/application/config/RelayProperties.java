package com.gardenalert.relay.application.config;

import com.gardenalert.common.model.RarityTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "relay")
public record RelayProperties(
        @NotNull @Valid Poll poll,
        @NotNull @Valid Upstream upstream,
        @NotNull @Valid Dedup dedup,
        @NotNull @Valid Policy policy,
        @NotNull @Valid Rarity rarity,
        @NotNull @Valid Event event,
        @NotNull @Valid Dispatch dispatch,
        @NotNull @Valid Push push,
        @NotNull @Valid Admin admin
) {

    /**
     * Event detection only fires in the first {@code event.toleranceSeconds} of a minute, so
     * the gap between two ticks (interval plus the concurrent fetches) has to be shorter.
     */
    @AssertTrue(message = "relay.poll.interval-ms plus relay.upstream.timeout-ms must stay below relay.event.tolerance-seconds")
    public boolean isPollWithinEventTolerance() {
        if (poll == null || upstream == null || event == null) {
            return true;
        }
        return poll.intervalMs() + upstream.timeoutMs() < event.toleranceSeconds() * 1000L;
    }

    public record Poll(@Min(1000) long intervalMs, @Min(0) long initialDelayMs) {}

    /**
     * Game-data API. A blank {@code apiKey} makes every fetch fail fast.
     */
    public record Upstream(
            @NotBlank String baseUrl,
            String apiKey,
            @NotBlank String stockPath,
            @NotBlank String weatherPath,
            @NotBlank String eventPath,
            @Min(100) int timeoutMs
    ) {}

    public record Dedup(@NotNull Duration window) {}

    public record Policy(@NotNull RarityTier premiumTier) {}

    /**
     * @param overrides tier per upstream item id, consulted before anything else
     */
    public record Rarity(@NotBlank String classificationFile, Map<String, RarityTier> overrides) {

        public Rarity {
            overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
        }
    }

    public record Event(
            @Min(60000) long refreshIntervalMs,
            int triggerMinuteCorrection,
            @Min(1) @Max(60) int toleranceSeconds
    ) {}

    public record Dispatch(@Min(1) int threads) {}

    public record Push(boolean enabled, String baseUrl, String topic, String authToken, @Min(100) int timeoutMs) {}

    /**
     * @param apiSecret blank leaves the admin endpoints rejecting every call
     */
    public record Admin(String apiSecret) {}
}
