package com.gardenalert.relay.domain.exceptions;

import com.gardenalert.relay.domain.detection.ChangeDetector;

public class InvalidRegistrationException extends RuntimeException {

    private InvalidRegistrationException(String message) {
        super(message);
    }

    public static InvalidRegistrationException unsupportedLead(int leadMinutes) {
        return new InvalidRegistrationException(
                "Lead minutes must be one of " + ChangeDetector.EVENT_LEAD_MINUTES + ", got " + leadMinutes);
    }

    public static InvalidRegistrationException unknownCategory(String category) {
        return new InvalidRegistrationException("Unknown item category: " + category);
    }
}
