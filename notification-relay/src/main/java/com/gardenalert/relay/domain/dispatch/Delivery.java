package com.gardenalert.relay.domain.dispatch;

import com.gardenalert.relay.domain.policy.IntentKind;

/**
 * A composed payload that passed the dedup gate and is owed to one device.
 */
public record Delivery(String deviceToken, IntentKind kind, NotificationPayload payload) {
}
