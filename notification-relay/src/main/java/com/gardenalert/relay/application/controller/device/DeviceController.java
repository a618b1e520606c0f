package com.gardenalert.relay.application.controller.device;

import com.gardenalert.relay.application.controller.device.mapper.DeviceRequestResponseMapper;
import com.gardenalert.relay.domain.registry.DeviceRegistrationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/devices")
@RequiredArgsConstructor
public class DeviceController {

    private final DeviceRegistrationService registrationService;
    private final DeviceRequestResponseMapper mapper;

    @PostMapping
    public RegisterDeviceResponse register(@Valid @RequestBody RegisterDeviceRequest request) {
        var registration = registrationService.register(mapper.toDomain(request));
        return mapper.toResponse(registration);
    }
}
