package com.gardenalert.relay.domain.registry;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class DeviceTokens {

    private static final int VISIBLE_PREFIX = 10;

    /**
     * Log-safe form of a device token: the first characters followed by an ellipsis.
     */
    public static String mask(String token) {
        if (token == null) {
            return "<none>";
        }
        if (token.length() <= VISIBLE_PREFIX) {
            return "***";
        }
        return token.substring(0, VISIBLE_PREFIX) + "...";
    }
}
