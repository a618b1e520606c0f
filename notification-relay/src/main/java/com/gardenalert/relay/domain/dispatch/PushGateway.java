package com.gardenalert.relay.domain.dispatch;

/**
 * Outbound push transport. Implementations report rejection through {@link PushResult}
 * and may also throw; the dispatcher treats both as a failed send.
 */
public interface PushGateway {

    PushResult send(NotificationPayload payload, String deviceToken);
}
