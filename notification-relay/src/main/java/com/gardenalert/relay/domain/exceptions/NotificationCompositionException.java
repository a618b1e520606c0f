package com.gardenalert.relay.domain.exceptions;

import com.gardenalert.relay.domain.policy.IntentKind;

public class NotificationCompositionException extends RuntimeException {

    private NotificationCompositionException(String message) {
        super(message);
    }

    public static NotificationCompositionException missingContent(IntentKind kind) {
        return new NotificationCompositionException(kind + " intent has nothing to announce");
    }
}
