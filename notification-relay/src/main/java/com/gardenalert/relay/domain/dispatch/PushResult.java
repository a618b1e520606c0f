package com.gardenalert.relay.domain.dispatch;

public record PushResult(int sentCount, int failedCount, String failureReason) {

    public static PushResult sent() {
        return new PushResult(1, 0, null);
    }

    public static PushResult failed(String reason) {
        return new PushResult(0, 1, reason);
    }

    public boolean isSuccess() {
        return failedCount == 0 && sentCount > 0;
    }
}
