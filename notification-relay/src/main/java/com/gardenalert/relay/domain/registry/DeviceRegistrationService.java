package com.gardenalert.relay.domain.registry;

import com.gardenalert.relay.domain.exceptions.InvalidRegistrationException;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceRegistrationService {

    private final DeviceRegistry deviceRegistry;
    private final Clock clock;

    /**
     * Idempotent upsert: the stored registration is replaced, never merged.
     */
    public DeviceRegistration register(DeviceRegistration registration) {
        if (!EventSettings.isSupportedLead(registration.eventSettings().leadMinutes())) {
            throw InvalidRegistrationException.unsupportedLead(registration.eventSettings().leadMinutes());
        }
        var stored = registration.toBuilder().registeredAt(clock.instant()).build();
        var replaced = deviceRegistry.get(stored.deviceToken()).isPresent();
        deviceRegistry.upsert(stored);
        log.info("{} device {} with {} item favorites, {} weather favorites",
                replaced ? "Re-registered" : "Registered",
                DeviceTokens.mask(stored.deviceToken()),
                stored.favoriteItemKeys().size(),
                stored.favoriteWeatherIds().size());
        return stored;
    }
}
