package com.gardenalert.relay.domain.exceptions;

public class UpstreamUnavailableException extends RuntimeException {

    private UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public static UpstreamUnavailableException notConfigured(String source) {
        return new UpstreamUnavailableException("No API key configured for " + source, null);
    }

    public static UpstreamUnavailableException requestFailed(String source, Throwable cause) {
        return new UpstreamUnavailableException(source + " request failed: " + cause.getMessage(), cause);
    }

    public static UpstreamUnavailableException emptyResponse(String source) {
        return new UpstreamUnavailableException(source + " returned an empty body", null);
    }
}
