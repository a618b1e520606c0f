package com.gardenalert.relay.infrastructure.upstream;

import com.gardenalert.relay.application.config.RelayProperties;
import com.gardenalert.relay.domain.catalog.EventFetcher;
import com.gardenalert.relay.domain.catalog.EventState;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads the scheduled event and applies the configured trigger-minute correction, since
 * the upstream minute is known to drift from the in-game start.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpEventFetcher implements EventFetcher {

    private final GameDataClient gameDataClient;
    private final RelayProperties properties;

    @Override
    public Optional<EventState> fetchEvent() {
        var response = gameDataClient.fetchEvent();
        if (response.eventName() == null || response.eventName().isBlank() || response.triggerMinute() == null) {
            log.debug("No event scheduled upstream");
            return Optional.empty();
        }
        var corrected = Math.floorMod(
                response.triggerMinute() + properties.event().triggerMinuteCorrection(), 60);
        return Optional.of(new EventState(response.eventName().trim(), corrected));
    }
}
