package com.gardenalert.relay.application.controller.admin;

import com.gardenalert.relay.domain.exceptions.InvalidApiSecretException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Checks the {@code X-Api-Secret} header in constant time. With no secret configured every
 * call is rejected.
 */
@Slf4j
@Component
public class AdminSecretVerifier {

    private final byte[] expected;

    public AdminSecretVerifier(@Value("${relay.admin.api-secret:}") String apiSecret) {
        this.expected = apiSecret == null ? new byte[0] : apiSecret.getBytes(StandardCharsets.UTF_8);
        if (expected.length == 0) {
            log.warn("relay.admin.api-secret is not set, admin endpoints will reject every call");
        }
    }

    public void verify(String presented) {
        if (presented == null || expected.length == 0
                || !MessageDigest.isEqual(expected, presented.getBytes(StandardCharsets.UTF_8))) {
            throw InvalidApiSecretException.rejected();
        }
    }
}
