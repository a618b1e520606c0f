package com.gardenalert.relay.domain.registry;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Device store. Written by the registration endpoint, read by the engine.
 */
public interface DeviceRegistry {

    Optional<DeviceRegistration> get(String deviceToken);

    void upsert(DeviceRegistration registration);

    Collection<DeviceRegistration> all();

    int size();

    /**
     * Union of favorite item keys over all registered devices.
     */
    Set<String> trackedItemKeys();
}
