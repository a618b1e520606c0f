package com.gardenalert.relay.domain.exceptions;

public class InvalidApiSecretException extends RuntimeException {

    private InvalidApiSecretException(String message) {
        super(message);
    }

    public static InvalidApiSecretException rejected() {
        return new InvalidApiSecretException("Invalid API secret");
    }
}
