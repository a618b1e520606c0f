package com.gardenalert.relay.infrastructure.memory;

import com.gardenalert.relay.domain.registry.DeviceRegistration;
import com.gardenalert.relay.domain.registry.DeviceRegistry;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Process-local registry. Registrations are whole immutable values, so an upsert is a
 * single map write and readers never observe a half-updated device.
 */
@Component
public class InMemoryDeviceRegistry implements DeviceRegistry {

    private final ConcurrentHashMap<String, DeviceRegistration> devices = new ConcurrentHashMap<>();

    @Override
    public Optional<DeviceRegistration> get(String deviceToken) {
        return Optional.ofNullable(devices.get(deviceToken));
    }

    @Override
    public void upsert(DeviceRegistration registration) {
        devices.put(registration.deviceToken(), registration);
    }

    @Override
    public Collection<DeviceRegistration> all() {
        return List.copyOf(devices.values());
    }

    @Override
    public int size() {
        return devices.size();
    }

    @Override
    public Set<String> trackedItemKeys() {
        return devices.values().stream()
                .filter(DeviceRegistration::notificationsEnabled)
                .flatMap(device -> device.favoriteItemKeys().stream())
                .collect(Collectors.toUnmodifiableSet());
    }
}
