package com.gardenalert.relay.application.controller.admin;

import com.gardenalert.relay.application.controller.admin.mapper.CycleReportResponseMapper;
import com.gardenalert.relay.domain.relay.NotificationRelayEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator triggers. Each call waits for any running cycle to finish first.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    static final String SECRET_HEADER = "X-Api-Secret";

    private final NotificationRelayEngine engine;
    private final AdminSecretVerifier secretVerifier;
    private final CycleReportResponseMapper mapper;

    @PostMapping("/check-availability")
    public CycleReportResponse checkAvailability(@RequestHeader(value = SECRET_HEADER, required = false) String secret) {
        secretVerifier.verify(secret);
        log.info("Manual availability check requested");
        return mapper.toResponse(engine.checkAvailability());
    }

    @PostMapping("/refresh")
    public CycleReportResponse refresh(@RequestHeader(value = SECRET_HEADER, required = false) String secret) {
        secretVerifier.verify(secret);
        log.info("Manual poll cycle requested");
        return mapper.toResponse(engine.runCycle());
    }

    @PostMapping("/notification-cache/clear")
    public CacheClearedResponse clearNotificationCache(
            @RequestHeader(value = SECRET_HEADER, required = false) String secret) {
        secretVerifier.verify(secret);
        return new CacheClearedResponse(engine.clearNotificationCache());
    }
}
