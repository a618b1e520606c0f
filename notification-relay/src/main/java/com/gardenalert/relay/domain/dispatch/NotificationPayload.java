package com.gardenalert.relay.domain.dispatch;

import java.util.Map;
import lombok.Builder;

/**
 * Gateway-ready alert. {@code sound} is null when the device has sound switched off.
 */
@Builder
public record NotificationPayload(
        String notificationId,
        String title,
        String body,
        int badge,
        String sound,
        String threadId,
        String category,
        String type,
        Map<String, Object> data
) {

    public NotificationPayload {
        data = data == null ? Map.of() : Map.copyOf(data);
    }
}
