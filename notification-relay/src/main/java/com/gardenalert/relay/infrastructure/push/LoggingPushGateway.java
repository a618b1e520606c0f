package com.gardenalert.relay.infrastructure.push;

import com.gardenalert.relay.domain.dispatch.NotificationPayload;
import com.gardenalert.relay.domain.dispatch.PushGateway;
import com.gardenalert.relay.domain.dispatch.PushResult;
import com.gardenalert.relay.domain.registry.DeviceTokens;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Stand-in gateway for environments without push credentials: records the send in the
 * log and reports success.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "relay.push", name = "enabled", havingValue = "false", matchIfMissing = true)
public class LoggingPushGateway implements PushGateway {

    @Override
    public PushResult send(NotificationPayload payload, String deviceToken) {
        log.info("Simulated push id={} to {}: [{}] {} | {}",
                payload.notificationId(), DeviceTokens.mask(deviceToken), payload.threadId(),
                payload.title(), payload.body());
        return PushResult.sent();
    }
}
